package com.aegis.config;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Yearly schedules read from the bundled calendar JSON: FOMC meeting days,
 * index rebalance windows and recurring sector events.
 *
 * <p>Loaded once at startup. A malformed resource fails fast with
 * {@link IllegalStateException}.
 */
public final class CalendarData {
    private static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MM-dd");

    private final Map<Integer, List<MonthDay>> fomcByYear;
    private final List<MonthDay> fomcDefault;
    private final Map<String, List<RebalanceWindow>> rebalanceByIndex;
    private final List<SectorEventSpec> sectorEvents;

    public record RebalanceWindow(LocalDate announceDate, LocalDate effectiveDate) {
    }

    public record SectorEventSpec(String name,
                                  String type,
                                  List<String> sectors,
                                  MonthDay start,
                                  MonthDay end,
                                  String location,
                                  String impact,
                                  List<String> relatedStocks,
                                  String description,
                                  String strategy) {
    }

    private CalendarData(Map<Integer, List<MonthDay>> fomcByYear,
                         List<MonthDay> fomcDefault,
                         Map<String, List<RebalanceWindow>> rebalanceByIndex,
                         List<SectorEventSpec> sectorEvents) {
        this.fomcByYear = fomcByYear;
        this.fomcDefault = fomcDefault;
        this.rebalanceByIndex = rebalanceByIndex;
        this.sectorEvents = sectorEvents;
    }

    public static CalendarData load(Config config) {
        return loadResource(config.getString("calendar.resource", "calendar/aegis-calendar.json"));
    }

    public static CalendarData loadResource(String resource) {
        try (InputStream in = CalendarData.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("calendar resource not found: " + resource);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("failed to read calendar resource " + resource, e);
        }
    }

    public static CalendarData parse(String json) {
        try {
            JSONObject root = new JSONObject(json);

            Map<Integer, List<MonthDay>> fomc = new TreeMap<>();
            List<MonthDay> fomcDefault = List.of();
            JSONObject fomcJson = root.optJSONObject("fomc");
            if (fomcJson != null) {
                for (String key : fomcJson.keySet()) {
                    List<MonthDay> days = monthDays(fomcJson.getJSONArray(key));
                    if ("default".equals(key)) {
                        fomcDefault = days;
                    } else {
                        fomc.put(Integer.parseInt(key), days);
                    }
                }
            }

            Map<String, List<RebalanceWindow>> rebalance = new LinkedHashMap<>();
            JSONObject rebalanceJson = root.optJSONObject("rebalance");
            if (rebalanceJson != null) {
                for (String index : rebalanceJson.keySet()) {
                    JSONObject years = rebalanceJson.getJSONObject(index);
                    List<RebalanceWindow> windows = new ArrayList<>();
                    for (String year : years.keySet()) {
                        JSONArray arr = years.getJSONArray(year);
                        for (int i = 0; i < arr.length(); i++) {
                            JSONObject w = arr.getJSONObject(i);
                            windows.add(new RebalanceWindow(
                                    LocalDate.parse(w.getString("announce")),
                                    LocalDate.parse(w.getString("effective"))));
                        }
                    }
                    windows.sort((a, b) -> a.effectiveDate().compareTo(b.effectiveDate()));
                    rebalance.put(index, Collections.unmodifiableList(windows));
                }
            }

            List<SectorEventSpec> events = new ArrayList<>();
            JSONArray eventsJson = root.optJSONArray("sector_events");
            if (eventsJson != null) {
                for (int i = 0; i < eventsJson.length(); i++) {
                    JSONObject e = eventsJson.getJSONObject(i);
                    MonthDay start = MonthDay.parse(e.getString("start"), MONTH_DAY);
                    String end = e.optString("end", "");
                    events.add(new SectorEventSpec(
                            e.getString("name"),
                            e.optString("type", "CONFERENCE"),
                            strings(e.optJSONArray("sectors")),
                            start,
                            end.isEmpty() ? start : MonthDay.parse(end, MONTH_DAY),
                            e.optString("location", ""),
                            e.optString("impact", "MEDIUM"),
                            strings(e.optJSONArray("related")),
                            e.optString("description", ""),
                            e.optString("strategy", "")));
                }
            }
            return new CalendarData(fomc, fomcDefault, rebalance, Collections.unmodifiableList(events));
        } catch (JSONException | IllegalArgumentException | DateTimeException e) {
            throw new IllegalStateException("malformed calendar data: " + e.getMessage(), e);
        }
    }

    /** FOMC decision days for the year, or the default list when the year is not listed. */
    public List<LocalDate> fomcDates(int year) {
        List<MonthDay> days = fomcByYear.getOrDefault(year, fomcDefault);
        List<LocalDate> out = new ArrayList<>(days.size());
        for (MonthDay md : days) {
            out.add(md.atYear(year));
        }
        return out;
    }

    public Map<String, List<RebalanceWindow>> allRebalanceWindows() {
        return Collections.unmodifiableMap(rebalanceByIndex);
    }

    public List<SectorEventSpec> sectorEvents() {
        return sectorEvents;
    }

    private static List<MonthDay> monthDays(JSONArray arr) {
        List<MonthDay> out = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            out.add(MonthDay.parse(arr.getString(i), MONTH_DAY));
        }
        return Collections.unmodifiableList(out);
    }

    private static List<String> strings(JSONArray arr) {
        if (arr == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            out.add(arr.getString(i));
        }
        return Collections.unmodifiableList(out);
    }
}

package com.alvinliu.weathermcp.weather;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns OpenWeatherMap JSON payloads into plain-text reports.
 * Missing or mistyped fields throw IllegalArgumentException naming the field path.
 */
public class WeatherReportFormatter {

    private static final DateTimeFormatter DAY_NAME = DateTimeFormatter.ofPattern("EEEE, MMMM dd", Locale.ENGLISH);

    /** Payload of GET /weather. */
    public String formatCurrent(JsonObject data, WeatherOptions.Units units) {
        JsonObject main = object(data, "main");
        JsonObject wind = object(data, "wind");
        String t = units.getTemperatureSymbol();

        StringBuilder sb = new StringBuilder();
        sb.append("Weather Report for ").append(place(data, optionalObject(data, "sys"))).append("\n\n");
        sb.append("Temperature: ").append(number(main, "temp")).append(t)
            .append(" (feels like ").append(number(main, "feels_like")).append(t).append(")\n");
        sb.append("Conditions: ").append(titleCase(description(data))).append("\n");
        sb.append("Humidity: ").append(number(main, "humidity")).append("%\n");
        sb.append("Wind Speed: ").append(number(wind, "speed")).append(" ").append(units.getWindUnit()).append("\n");
        sb.append("Pressure: ").append(number(main, "pressure")).append(" hPa");
        return sb.toString();
    }

    /**
     * Payload of GET /forecast (3-hour steps). One block per calendar date, first {@code days} dates only;
     * conditions come from the entry nearest 12:00, min/max span the whole date.
     */
    public String formatForecast(JsonObject data, WeatherOptions.Units units, int days) {
        JsonObject city = object(data, "city");
        JsonArray list = array(data, "list");
        String t = units.getTemperatureSymbol();

        Map<String, List<JsonObject>> byDate = new LinkedHashMap<>();
        for (JsonElement e : list) {
            if (!e.isJsonObject()) throw new IllegalArgumentException("list entry is not an object");
            JsonObject item = e.getAsJsonObject();
            String dtTxt = string(item, "dt_txt");
            int space = dtTxt.indexOf(' ');
            String date = space > 0 ? dtTxt.substring(0, space) : dtTxt;
            byDate.computeIfAbsent(date, k -> new ArrayList<>()).add(item);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(days).append("-Day Weather Forecast for ").append(place(city, city)).append("\n\n");
        int shown = 0;
        for (Map.Entry<String, List<JsonObject>> day : byDate.entrySet()) {
            if (shown >= days) break;
            List<JsonObject> entries = day.getValue();
            JsonObject midday = entries.get(0);
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            for (JsonObject item : entries) {
                if (distanceFromNoon(item) < distanceFromNoon(midday)) midday = item;
                JsonObject main = object(item, "main");
                min = Math.min(min, decimal(main, "temp_min"));
                max = Math.max(max, decimal(main, "temp_max"));
            }
            sb.append(dayName(day.getKey())).append("\n");
            sb.append("   Temperature: ").append(oneDecimal(min)).append(t)
                .append(" - ").append(oneDecimal(max)).append(t).append("\n");
            sb.append("   Conditions: ").append(titleCase(description(midday))).append("\n");
            sb.append("   Humidity: ").append(number(object(midday, "main"), "humidity")).append("%\n\n");
            shown++;
        }
        return sb.toString().trim();
    }

    /** "light rain" -> "Light Rain". */
    static String titleCase(String s) {
        StringBuilder out = new StringBuilder(s.length());
        boolean startOfWord = true;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLetter(c)) {
                out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                out.append(c);
                startOfWord = true;
            }
        }
        return out.toString();
    }

    private static String place(JsonObject named, JsonObject withCountry) {
        String name = string(named, "name");
        if (withCountry != null && withCountry.has("country") && !withCountry.get("country").isJsonNull()) {
            return name + ", " + withCountry.get("country").getAsString();
        }
        return name;
    }

    private static String description(JsonObject item) {
        JsonArray weather = array(item, "weather");
        if (weather.size() == 0 || !weather.get(0).isJsonObject()) {
            throw new IllegalArgumentException("weather[0] missing");
        }
        return string(weather.get(0).getAsJsonObject(), "description");
    }

    private static int distanceFromNoon(JsonObject item) {
        String dtTxt = string(item, "dt_txt");
        int space = dtTxt.indexOf(' ');
        if (space < 0 || dtTxt.length() < space + 3) return Integer.MAX_VALUE;
        try {
            return Math.abs(12 - Integer.parseInt(dtTxt.substring(space + 1, space + 3)));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static String dayName(String isoDate) {
        try {
            return LocalDate.parse(isoDate).format(DAY_NAME);
        } catch (DateTimeParseException e) {
            return isoDate;
        }
    }

    private static String oneDecimal(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }

    private static JsonObject object(JsonObject parent, String key) {
        JsonElement e = parent.get(key);
        if (e == null || !e.isJsonObject()) throw new IllegalArgumentException("missing object: " + key);
        return e.getAsJsonObject();
    }

    private static JsonObject optionalObject(JsonObject parent, String key) {
        JsonElement e = parent.get(key);
        return e != null && e.isJsonObject() ? e.getAsJsonObject() : null;
    }

    private static JsonArray array(JsonObject parent, String key) {
        JsonElement e = parent.get(key);
        if (e == null || !e.isJsonArray()) throw new IllegalArgumentException("missing array: " + key);
        return e.getAsJsonArray();
    }

    private static String string(JsonObject parent, String key) {
        JsonElement e = parent.get(key);
        if (e == null || !e.isJsonPrimitive()) throw new IllegalArgumentException("missing field: " + key);
        return e.getAsString();
    }

    // Keeps the upstream spelling of the number (15.3 stays 15.3, 72 stays 72).
    private static String number(JsonObject parent, String key) {
        JsonElement e = parent.get(key);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException("missing number: " + key);
        }
        return e.getAsString();
    }

    private static double decimal(JsonObject parent, String key) {
        JsonElement e = parent.get(key);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException("missing number: " + key);
        }
        return e.getAsDouble();
    }
}

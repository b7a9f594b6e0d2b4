package com.alvinliu.weathermcp.weather;

/**
 * Optional tool arguments after defaulting. days is ignored for current conditions.
 */
public class WeatherOptions {
    public static final int DEFAULT_DAYS = 5;
    public static final int MIN_DAYS = 1;
    public static final int MAX_DAYS = 5;

    private final Units units;
    private final int days;

    public WeatherOptions(Units units, int days) {
        this.units = units != null ? units : Units.METRIC;
        this.days = days;
    }

    public static WeatherOptions defaults() {
        return new WeatherOptions(Units.METRIC, DEFAULT_DAYS);
    }

    public Units getUnits() { return units; }
    public int getDays() { return days; }

    /** Temperature units as exposed in the tool schema. */
    public enum Units {
        METRIC("metric", "metric", "°C", "m/s"),
        IMPERIAL("imperial", "imperial", "°F", "mph"),
        KELVIN("kelvin", "standard", "K", "m/s");

        private final String argValue;
        private final String apiValue;
        private final String temperatureSymbol;
        private final String windUnit;

        Units(String argValue, String apiValue, String temperatureSymbol, String windUnit) {
            this.argValue = argValue;
            this.apiValue = apiValue;
            this.temperatureSymbol = temperatureSymbol;
            this.windUnit = windUnit;
        }

        public String getArgValue() { return argValue; }
        /** OpenWeatherMap calls kelvin "standard". */
        public String getApiValue() { return apiValue; }
        public String getTemperatureSymbol() { return temperatureSymbol; }
        public String getWindUnit() { return windUnit; }

        /** @return the matching unit, or null if the argument is not one of the schema enum values */
        public static Units fromArg(String value) {
            if (value == null) return null;
            for (Units u : values()) {
                if (u.argValue.equalsIgnoreCase(value.trim())) return u;
            }
            return null;
        }
    }
}

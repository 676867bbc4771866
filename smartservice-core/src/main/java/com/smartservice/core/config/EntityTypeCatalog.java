package com.smartservice.core.config;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Built-in attribute catalog of common FIWARE smart data model entity types.
 *
 * <p>Used as the default for {@link CompilerConfig#entityTypes()}:
 * <pre>{@code
 * entityTypes:
 *   AirQualityObserved: [location, dateObserved, NOx, O3, ...]
 * }</pre>
 */
public final class EntityTypeCatalog {

    private EntityTypeCatalog() {
        // Utility class
    }

    private static final List<String> COMMON = List.of(
        "id", "type", "location", "address", "dateObserved", "dateCreated", "dateModified",
        "areaServed", "source", "dataProvider", "name", "description"
    );

    public static final Map<String, List<String>> DEFAULT_ENTITY_TYPES = Map.ofEntries(
        Map.entry("AirQualityObserved", with(
            "refPointOfInterest", "airQualityIndex", "airQualityLevel", "reliability",
            "temperature", "relativeHumidity", "precipitation", "windDirection", "windSpeed",
            "CO", "NO", "NO2", "NOx", "SO2", "O3", "PM1", "PM10", "PM2.5", "C6H6", "CO2",
            "NH3", "H2S", "volatileOrganicCompoundsTotal", "typeofLocation"
        )),
        Map.entry("WeatherObserved", with(
            "temperature", "relativeHumidity", "atmosphericPressure", "pressureTendency",
            "windDirection", "windSpeed", "precipitation", "illuminance", "dewPoint",
            "uVIndexMax", "weatherType", "visibility", "snowHeight", "solarRadiation"
        )),
        Map.entry("NoiseLevelObserved", with(
            "dateObservedFrom", "dateObservedTo", "LAeq", "LAmax", "LAS", "LAeq_d",
            "sonometerClass", "refPointOfInterest"
        )),
        Map.entry("TrafficFlowObserved", with(
            "dateObservedFrom", "dateObservedTo", "laneId", "laneDirection", "intensity",
            "occupancy", "averageVehicleSpeed", "averageVehicleLength", "averageGapDistance",
            "averageHeadwayTime", "congested", "vehicleType", "refRoadSegment"
        )),
        Map.entry("WaterQualityObserved", with(
            "temperature", "conductivity", "conductance", "pH", "turbidity", "O2", "NO3",
            "NH4", "PO4", "Cl", "tss", "tds", "salinity"
        ))
    );

    public static final List<String> DEFAULT_GEO_ATTRIBUTES = List.of("location", "geometry", "coordinates");

    public static final List<String> DEFAULT_TIME_ATTRIBUTES = List.of(
        "dateObserved", "dateObservedFrom", "dateObservedTo", "dateCreated", "dateModified", "timestamp"
    );

    private static List<String> with(String... specific) {
        return Stream.concat(COMMON.stream(), Stream.of(specific))
            .toList();
    }
}

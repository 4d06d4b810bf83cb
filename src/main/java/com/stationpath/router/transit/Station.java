package com.stationpath.router.transit;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A node of the station graph: a place where passengers board or alight.
 * Either coordinate may be missing in the source data, in which case the station cannot inform the search heuristic.
 */
public class Station {

    public final String id;

    public final String name;

    /** Degrees, null when unknown. */
    public final Double lat;

    /** Degrees, null when unknown. */
    public final Double lon;

    public Station (String id, String name, Double lat, Double lon) {
        this.id = Preconditions.checkNotNull(id);
        this.name = name;
        this.lat = lat;
        this.lon = lon;
    }

    public boolean hasCoordinates () {
        return lat != null && lon != null;
    }

    /** The name if there is one, otherwise the id. */
    public String displayName () {
        return name == null || name.isBlank() ? id : name;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Station station = (Station) o;
        return id.equals(station.id) && Objects.equals(name, station.name) &&
                Objects.equals(lat, station.lat) && Objects.equals(lon, station.lon);
    }

    @Override
    public int hashCode () {
        return Objects.hash(id, name, lat, lon);
    }

    @Override
    public String toString () {
        return String.format("Station %s (%s)", id, name);
    }

}

package com.daniel.feedarr.upstream;

import java.time.LocalDate;

/**
 * Query for the calendar resource.
 *
 * @param end         last release date (inclusive) to include
 * @param unmonitored whether unmonitored movies are returned as well
 */
public record CalendarQuery(LocalDate end, boolean unmonitored) {
}

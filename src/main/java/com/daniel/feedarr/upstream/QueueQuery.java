package com.daniel.feedarr.upstream;

public record QueueQuery(int pageSize, boolean includeUnknownMovieItems) {
}

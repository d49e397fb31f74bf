package com.example.requestcache.query;

import java.util.List;

/**
 * What the data store returns for one page: the rows and the total match count.
 */
public record PageSlice<T>(List<T> rows, long totalCount) {

    public PageSlice {
        rows = List.copyOf(rows);
    }
}

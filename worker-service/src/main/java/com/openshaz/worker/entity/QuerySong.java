package com.openshaz.worker.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.util.List;

@Entity
@Table(name = "query_songs", indexes = {
        @Index(name = "idx_query_songs_name", columnList = "name")
})
public class QuerySong extends AudioFeatures {

    public QuerySong() {
    }

    public QuerySong(Integer id, String name, String bucketUrl, List<Double> features) {
        super(id, name, bucketUrl, features);
    }
}

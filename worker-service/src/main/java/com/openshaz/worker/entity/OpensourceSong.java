package com.openshaz.worker.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.util.List;

@Entity
@Table(name = "opensource_songs", indexes = {
        @Index(name = "idx_opensource_songs_name", columnList = "name")
})
public class OpensourceSong extends AudioFeatures {

    public OpensourceSong() {
    }

    public OpensourceSong(Integer id, String name, String bucketUrl, List<Double> features) {
        super(id, name, bucketUrl, features);
    }
}

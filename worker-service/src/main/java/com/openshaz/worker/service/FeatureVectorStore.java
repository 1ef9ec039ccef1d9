package com.openshaz.worker.service;

import com.openshaz.common.exception.JobValidationException;
import com.openshaz.worker.entity.AudioFeatures;
import com.openshaz.worker.entity.OpensourceSong;
import com.openshaz.worker.entity.QuerySong;
import com.openshaz.worker.entity.SongKind;
import com.openshaz.worker.repository.OpensourceSongRepository;
import com.openshaz.worker.repository.QuerySongRepository;
import com.openshaz.worker.similarity.FeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Feature vectors of reference and query songs in PostgreSQL.
 * Row ids come from the file name ("00042_blues.wav" is 42), so storing the same song twice
 * keeps the first row.
 */
@Slf4j
@Service
public class FeatureVectorStore {

    private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d+)");

    @Autowired
    private OpensourceSongRepository opensourceSongRepository;

    @Autowired
    private QuerySongRepository querySongRepository;

    @Transactional(readOnly = true)
    public List<FeatureVector> fetchAll(SongKind kind) {
        List<? extends AudioFeatures> rows = kind == SongKind.OPENSOURCE
                ? opensourceSongRepository.findAllByOrderByIdAsc()
                : querySongRepository.findAllByOrderByIdAsc();

        List<FeatureVector> vectors = new ArrayList<>(rows.size());
        for (AudioFeatures row : rows) {
            vectors.add(toVector(row));
        }
        log.info("Fetched {} {} songs from database", vectors.size(), kind.name().toLowerCase());
        return vectors;
    }

    @Transactional(readOnly = true)
    public Optional<FeatureVector> findByName(SongKind kind, String name) {
        Optional<? extends AudioFeatures> row = kind == SongKind.OPENSOURCE
                ? opensourceSongRepository.findFirstByName(name)
                : querySongRepository.findFirstByName(name);
        return row.map(FeatureVectorStore::toVector);
    }

    /**
     * Insert a song's features under the id parsed from its name. If a row with that id
     * exists it is returned untouched.
     *
     * @throws JobValidationException if the name carries no numeric id or the vector is unusable
     */
    @Transactional
    public FeatureVector storeOne(SongKind kind, String name, String bucketUrl, double[] features) {
        int id = idFromName(name).orElseThrow(() ->
                new JobValidationException("Could not extract ID from filename: " + name));
        List<Double> values = toList(features);

        if (kind == SongKind.OPENSOURCE) {
            Optional<OpensourceSong> existing = opensourceSongRepository.findById(id);
            if (existing.isPresent()) {
                log.info("Opensource song already exists: {} (id={})", name, id);
                return toVector(existing.get());
            }
            OpensourceSong saved = opensourceSongRepository.save(new OpensourceSong(id, name, bucketUrl, values));
            log.info("Stored opensource song: {} (id={})", name, id);
            return toVector(saved);
        }

        Optional<QuerySong> existing = querySongRepository.findById(id);
        if (existing.isPresent()) {
            log.info("Query song already exists: {} (id={})", name, id);
            return toVector(existing.get());
        }
        QuerySong saved = querySongRepository.save(new QuerySong(id, name, bucketUrl, values));
        log.info("Stored query song: {} (id={})", name, id);
        return toVector(saved);
    }

    public long count(SongKind kind) {
        return kind == SongKind.OPENSOURCE ? opensourceSongRepository.count() : querySongRepository.count();
    }

    /**
     * Leading digits of the base name without extension, e.g. "00002.mp3" gives 2.
     */
    public static OptionalInt idFromName(String name) {
        if (name == null) {
            return OptionalInt.empty();
        }
        String baseName = name.substring(Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\')) + 1);
        Matcher matcher = LEADING_DIGITS.matcher(baseName);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return OptionalInt.empty();
        }
    }

    private static List<Double> toList(double[] features) {
        if (features == null || features.length == 0) {
            throw new JobValidationException("Feature vector must not be empty");
        }
        List<Double> values = new ArrayList<>(features.length);
        for (double value : features) {
            if (!Double.isFinite(value)) {
                throw new JobValidationException("Feature vector contains a non-finite value: " + value);
            }
            values.add(value);
        }
        return values;
    }

    private static FeatureVector toVector(AudioFeatures row) {
        return new FeatureVector(row.getId(), row.getName(), row.featureArray());
    }
}

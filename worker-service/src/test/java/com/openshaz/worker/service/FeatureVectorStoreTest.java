package com.openshaz.worker.service;

import com.openshaz.common.exception.JobValidationException;
import com.openshaz.worker.entity.OpensourceSong;
import com.openshaz.worker.entity.QuerySong;
import com.openshaz.worker.entity.SongKind;
import com.openshaz.worker.repository.OpensourceSongRepository;
import com.openshaz.worker.repository.QuerySongRepository;
import com.openshaz.worker.similarity.FeatureVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FeatureVectorStore: id parsing, insert-once semantics and vector conversion.
 */
@ExtendWith(MockitoExtension.class)
class FeatureVectorStoreTest {

    @Mock
    private OpensourceSongRepository opensourceSongRepository;

    @Mock
    private QuerySongRepository querySongRepository;

    @InjectMocks
    private FeatureVectorStore featureVectorStore;

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Id parsing
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should take the id from the leading digits of the file name")
    void idFromName_parsesLeadingDigits() {
        assertEquals(OptionalInt.of(2), FeatureVectorStore.idFromName("00002.mp3"));
        assertEquals(OptionalInt.of(42), FeatureVectorStore.idFromName("00042_blues.wav"));
        assertEquals(OptionalInt.of(7), FeatureVectorStore.idFromName("dataset/007.wav"));
    }

    @Test
    @DisplayName("Should find no id in names without leading digits")
    void idFromName_emptyWithoutDigits() {
        assertTrue(FeatureVectorStore.idFromName("blues.00042.wav").isEmpty());
        assertTrue(FeatureVectorStore.idFromName("99999999999999.wav").isEmpty());
        assertTrue(FeatureVectorStore.idFromName(null).isEmpty());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Store
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should insert a new reference song under its parsed id")
    void storeOne_shouldInsertNewSong() {
        when(opensourceSongRepository.findById(42)).thenReturn(Optional.empty());
        when(opensourceSongRepository.save(any(OpensourceSong.class))).thenAnswer(inv -> inv.getArgument(0));

        FeatureVector stored = featureVectorStore.storeOne(SongKind.OPENSOURCE, "00042.wav", "u", new double[] {1.0, 2.0});

        ArgumentCaptor<OpensourceSong> captor = ArgumentCaptor.forClass(OpensourceSong.class);
        verify(opensourceSongRepository).save(captor.capture());
        assertEquals(42, captor.getValue().getId());
        assertEquals(List.of(1.0, 2.0), captor.getValue().getFeatures());
        assertEquals(42, stored.id());
        assertArrayEquals(new double[] {1.0, 2.0}, stored.vector());
    }

    @Test
    @DisplayName("Should keep the existing row when the id is already stored")
    void storeOne_shouldKeepExistingRow() {
        QuerySong existing = new QuerySong(7, "00007.wav", "old-url", List.of(9.0, 9.0));
        when(querySongRepository.findById(7)).thenReturn(Optional.of(existing));

        FeatureVector stored = featureVectorStore.storeOne(SongKind.QUERY, "00007.wav", "new-url", new double[] {1.0, 1.0});

        assertArrayEquals(new double[] {9.0, 9.0}, stored.vector());
        verify(querySongRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should reject names without a numeric id")
    void storeOne_shouldRejectNameWithoutId() {
        assertThrows(JobValidationException.class,
                () -> featureVectorStore.storeOne(SongKind.OPENSOURCE, "song.wav", "u", new double[] {1.0}));
        verifyNoInteractions(opensourceSongRepository);
    }

    @Test
    @DisplayName("Should reject empty and non-finite vectors")
    void storeOne_shouldRejectBadVectors() {
        assertThrows(JobValidationException.class,
                () -> featureVectorStore.storeOne(SongKind.OPENSOURCE, "00001.wav", "u", new double[0]));
        assertThrows(JobValidationException.class,
                () -> featureVectorStore.storeOne(SongKind.OPENSOURCE, "00001.wav", "u", new double[] {Double.NaN}));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Read
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should convert every reference row into a feature vector in id order")
    void fetchAll_shouldConvertRows() {
        when(opensourceSongRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                new OpensourceSong(1, "00001.wav", "u1", List.of(1.0, 0.0)),
                new OpensourceSong(2, "00002.wav", "u2", List.of(0.0, 1.0))));

        List<FeatureVector> vectors = featureVectorStore.fetchAll(SongKind.OPENSOURCE);

        assertEquals(2, vectors.size());
        assertEquals("00001.wav", vectors.get(0).name());
        assertArrayEquals(new double[] {0.0, 1.0}, vectors.get(1).vector());
        verifyNoInteractions(querySongRepository);
    }

    @Test
    @DisplayName("Should look up query songs by name")
    void findByName_shouldUseQueryTable() {
        when(querySongRepository.findFirstByName("00007.wav"))
                .thenReturn(Optional.of(new QuerySong(7, "00007.wav", "u", List.of(0.5))));

        Optional<FeatureVector> found = featureVectorStore.findByName(SongKind.QUERY, "00007.wav");

        assertTrue(found.isPresent());
        assertEquals(7, found.get().id());
    }
}

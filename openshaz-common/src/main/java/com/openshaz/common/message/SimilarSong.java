package com.openshaz.common.message;

/**
 * One ranked reference song: its id and name from the reference set and the similarity score.
 */
public record SimilarSong(
        int id,
        String name,
        double similarity
) {
}

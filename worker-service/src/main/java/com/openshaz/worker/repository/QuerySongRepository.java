package com.openshaz.worker.repository;

import com.openshaz.worker.entity.QuerySong;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface QuerySongRepository extends JpaRepository<QuerySong, Integer> {

    List<QuerySong> findAllByOrderByIdAsc();

    // Repeat searches reuse the stored vector instead of extracting again
    Optional<QuerySong> findFirstByName(String name);
}

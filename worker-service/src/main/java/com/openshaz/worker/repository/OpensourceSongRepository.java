package com.openshaz.worker.repository;

import com.openshaz.worker.entity.OpensourceSong;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface OpensourceSongRepository extends JpaRepository<OpensourceSong, Integer> {

    // Reference set in a stable order, so equal scores rank the same way every time
    List<OpensourceSong> findAllByOrderByIdAsc();

    Optional<OpensourceSong> findFirstByName(String name);
}

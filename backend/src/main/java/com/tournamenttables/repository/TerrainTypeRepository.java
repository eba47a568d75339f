package com.tournamenttables.repository;

import com.tournamenttables.model.TerrainType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TerrainTypeRepository extends JpaRepository<TerrainType, Long> {
    List<TerrainType> findAllByOrderBySortOrderAscNameAsc();

    Optional<TerrainType> findByName(String name);
}

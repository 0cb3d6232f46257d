package com.lendingledger.repository.jpa;

import com.lendingledger.entity.PositionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions audit table. Written by the sync flush only.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, Long> {}

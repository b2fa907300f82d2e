package com.temple.booking.infrastructure.persistence.hall.jpa.repository;

import com.temple.booking.infrastructure.persistence.hall.jpa.entity.HallJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface HallJpaRepository extends JpaRepository<HallJpaEntity, Integer> {
    List<HallJpaEntity> findAllByOrderByIdAsc();
}

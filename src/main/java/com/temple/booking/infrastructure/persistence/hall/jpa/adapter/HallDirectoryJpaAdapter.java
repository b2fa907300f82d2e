package com.temple.booking.infrastructure.persistence.hall.jpa.adapter;

import com.temple.booking.application.port.out.HallDirectoryPort;
import com.temple.booking.domain.hall.Hall;
import com.temple.booking.infrastructure.persistence.hall.jpa.entity.HallJpaEntity;
import com.temple.booking.infrastructure.persistence.hall.jpa.repository.HallJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class HallDirectoryJpaAdapter implements HallDirectoryPort {

    private final HallJpaRepository repository;

    @Override
    public List<Hall> findAll() {
        return repository.findAllByOrderByIdAsc().stream()
                .map(HallJpaEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<Hall> findById(int hallId) {
        return repository.findById(hallId).map(HallJpaEntity::toDomain);
    }
}

package com.temple.booking.application.port.out;

import com.temple.booking.domain.hall.Hall;

import java.util.List;
import java.util.Optional;

// 읽기 전용 홀 목록 (표시용 짝맞춤에만 사용)
public interface HallDirectoryPort {
    List<Hall> findAll();
    Optional<Hall> findById(int hallId);
}

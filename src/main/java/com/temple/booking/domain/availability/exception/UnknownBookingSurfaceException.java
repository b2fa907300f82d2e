package com.temple.booking.domain.availability.exception;

// 설정에 없는 예약 화면(surface) 이름
public class UnknownBookingSurfaceException extends RuntimeException {
    public UnknownBookingSurfaceException(String surface) { super("unknown booking surface: " + surface); } }

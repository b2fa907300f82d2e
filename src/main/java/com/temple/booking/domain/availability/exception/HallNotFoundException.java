package com.temple.booking.domain.availability.exception;

public class HallNotFoundException extends RuntimeException {
    public HallNotFoundException(int hallId) { super("hall not found: " + hallId); } }

package com.aec.DriveSrv.dto;

public record ErrorResponseDto(String code, String message) {
}

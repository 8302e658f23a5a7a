package com.aec.DriveSrv.dto;

public record UserProfileDto(String id, String email, String name) {
}

package com.example.clipscore_backend.dto;

public record ExportedReport(String filename, byte[] content) {
}

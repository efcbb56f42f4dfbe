package com.example.clipscore_backend.model;

public record ColorProfile(double warmTones, double coldTones, boolean redDominant) {
}

package io.github.jakubt4.vista.client;

public record LatestSolResponse(Integer sol) {
}

package de.remsfal.defects.controller;

public record AnalyzeRequest(String filename, String text) {}

package de.remsfal.defects.inference;

public class InferenceDtos {

    public record ScoreRequest(String sentence, String category) {}

    public record ScoreResponse(Double probability, String modelVersion) {}
}

package com.eainde.research.gate;

public record GateDecision(boolean pass, double score, double threshold, String model) {
}

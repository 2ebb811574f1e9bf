package com.example.techsewa.brain;

public record SolveResult(AnswerSource source, String answer) {
}

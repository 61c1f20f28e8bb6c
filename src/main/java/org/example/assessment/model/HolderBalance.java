package org.example.assessment.model;

public record HolderBalance(
        String holder,
        String balance
) {
}

package com.deepansh.memgraph.salience;

import com.deepansh.memgraph.model.Fact;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

public record ScoredFact(@JsonUnwrapped Fact fact, double salienceScore) {
}

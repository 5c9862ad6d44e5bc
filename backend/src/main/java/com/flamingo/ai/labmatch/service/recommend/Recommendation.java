package com.flamingo.ai.labmatch.service.recommend;

import com.flamingo.ai.labmatch.domain.enums.FitnessLevel;
import com.flamingo.ai.labmatch.service.rerank.FinalScore;

/** A ranked lab recommendation. */
public record Recommendation(int rank, FinalScore score, FitnessLevel fitnessLevel) {}

/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.matching;

import com.meridian.codehistory.api.model.Window;
import com.meridian.codehistory.core.index.PatientPartition;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Finds the records of a patient partition that fall in an episode's window.
 *
 * <p>Implementations must be stateless and thread-safe, and must exclude any record whose
 * id equals {@code episodeId}.
 */
public interface IntervalMatcher {

    /**
     * Appends the positions of matching records to {@code out}, in ascending position order.
     *
     * @return number of candidate records examined
     */
    int match(PatientPartition partition, Window window, String episodeId, MatchPredicate predicate, IntList out);
}

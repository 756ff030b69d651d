package com.platform.failover.probe;

import com.platform.failover.model.ProbeSample;

/**
 * Receiver of scheduled probe samples. Must not block.
 */
@FunctionalInterface
public interface ProbeSampleListener {
    
    void onSample(ProbeSample sample);
}

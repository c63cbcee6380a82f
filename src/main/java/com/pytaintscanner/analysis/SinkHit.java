package com.pytaintscanner.analysis;

import com.pytaintscanner.config.SinkRule;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/** A tainted, unsanitized value reaching a sink argument, before backward confirmation. */
@Getter
@ToString
@AllArgsConstructor
public class SinkHit {
    private final String sinkCallId;
    private final SinkRule rule;
    private final TaintFact fact;
}

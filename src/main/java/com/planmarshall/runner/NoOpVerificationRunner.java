package com.planmarshall.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NoOpVerificationRunner implements VerificationRunner {

    private static final Logger log = LoggerFactory.getLogger(NoOpVerificationRunner.class);

    @Override
    public VerificationReport verify(VerificationRequest request) {
        log.info("No verification runner configured; reporting every check as passed for plan {}", request.planId());
        return VerificationReport.passed();
    }
}

package com.planmarshall.runner;

/**
 * Runs quality, build, domain-technical and test-coverage checks during 6-verify.
 */
public interface VerificationRunner {

    VerificationReport verify(VerificationRequest request);
}

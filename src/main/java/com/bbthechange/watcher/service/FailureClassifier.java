package com.bbthechange.watcher.service;

import com.bbthechange.watcher.exception.ExternalServiceException;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.io.IOException;

/**
 * Tells transient failures (worth retrying) apart from permanent ones.
 */
@Component
public class FailureClassifier {

    public boolean isRecoverable(Throwable failure) {
        if (failure instanceof ExternalServiceException externalFailure) {
            return externalFailure.isRecoverable();
        }
        if (failure instanceof IOException || failure instanceof SdkClientException) {
            return true;
        }
        if (failure instanceof AwsServiceException awsFailure) {
            return awsFailure.isThrottlingException() || awsFailure.statusCode() >= 500;
        }
        return false;
    }
}

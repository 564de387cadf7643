package com.xammer.probe.service.provider.aws;

import com.xammer.probe.exception.ProbeTimeoutException;
import com.xammer.probe.exception.ProviderException;
import com.xammer.probe.service.probe.ScrapeDeadline;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Binds every AWS request to the session deadline and translates SDK failures
 * into probe exceptions.
 */
class AwsRequestGuard {

    private final ScrapeDeadline deadline;

    AwsRequestGuard(ScrapeDeadline deadline) {
        this.deadline = deadline;
    }

    <T> T call(String operation, Function<AwsRequestOverrideConfiguration, T> request) {
        // remaining() is read once: the SDK rejects a zero apiCallTimeout.
        Duration remaining = deadline.remaining();
        if (remaining.isZero()) {
            throw new ProbeTimeoutException("deadline exceeded before " + operation);
        }
        AwsRequestOverrideConfiguration overrides = AwsRequestOverrideConfiguration.builder()
                .apiCallTimeout(remaining)
                .build();
        try {
            return request.apply(overrides);
        } catch (ApiCallTimeoutException | AbortedException e) {
            throw new ProbeTimeoutException(operation + " did not complete before the deadline", e);
        } catch (AwsServiceException e) {
            throw new ProviderException(operation + " rejected: " + describe(e), e);
        } catch (SdkException e) {
            throw new ProviderException(operation + " failed: " + e.getMessage(), e);
        }
    }

    void run(String operation, Consumer<AwsRequestOverrideConfiguration> request) {
        call(operation, overrides -> {
            request.accept(overrides);
            return null;
        });
    }

    static boolean hasErrorCode(Throwable e, String errorCode) {
        if (e instanceof ProviderException && e.getCause() instanceof AwsServiceException) {
            AwsErrorDetails details = ((AwsServiceException) e.getCause()).awsErrorDetails();
            return details != null && errorCode.equals(details.errorCode());
        }
        return false;
    }

    private static String describe(AwsServiceException e) {
        AwsErrorDetails details = e.awsErrorDetails();
        if (details == null) {
            return e.getMessage();
        }
        return details.errorCode() + ": " + details.errorMessage();
    }
}

package com.clusterscope.cloud.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialErrorClassifierTest {

    @Test
    void recognisesExpiredAndInvalidTokenMessages() {
        assertThat(CredentialErrorClassifier.isCredentialRelated("ExpiredToken: token expired")).isTrue();
        assertThat(CredentialErrorClassifier.isCredentialRelated(
                "The security token included in the request is invalid")).isTrue();
        assertThat(CredentialErrorClassifier.isCredentialRelated(
                "Unable to load credentials from any of the providers in the chain")).isTrue();
        assertThat(CredentialErrorClassifier.isCredentialRelated("Request failed with status 401")).isTrue();
    }

    @Test
    void ignoresOtherFailures() {
        assertThat(CredentialErrorClassifier.isCredentialRelated("Connection reset")).isFalse();
        assertThat(CredentialErrorClassifier.isCredentialRelated((String) null)).isFalse();
        assertThat(CredentialErrorClassifier.isCredentialRelated("")).isFalse();
    }

    @Test
    void looksThroughTheCauseChain() {
        RuntimeException error = new RuntimeException("Failed to get subnets",
                new IllegalStateException("ExpiredTokenException"));

        assertThat(CredentialErrorClassifier.isCredentialRelated(error)).isTrue();
        assertThat(CredentialErrorClassifier.isCredentialRelated(new RuntimeException("timeout"))).isFalse();
    }

    @Test
    void providerExceptionCarriesTheClassification() {
        ProviderException expired = ProviderException.from("get EKS cluster",
                new RuntimeException("The security token included in the request is expired"));
        ProviderException network = ProviderException.from("get EKS cluster", new RuntimeException("Connection refused"));

        assertThat(expired.isCredentialRelated()).isTrue();
        assertThat(expired.getMessage()).startsWith("Failed to get EKS cluster: ");
        assertThat(network.isCredentialRelated()).isFalse();
    }
}

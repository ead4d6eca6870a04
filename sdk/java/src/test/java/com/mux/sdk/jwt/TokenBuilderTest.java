package com.mux.sdk.jwt;

import com.mux.sdk.crypto.SigningException;
import com.mux.sdk.crypto.TestKeys;
import com.mux.sdk.key.KeyHandle;
import com.mux.sdk.key.KeyMaterial;
import com.mux.sdk.key.KeyNormalizer;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBuilderTest {
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final TokenBuilder builder = new TokenBuilder(new NimbusTokenSigner(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void base64Pkcs8KeySignsVerifiableToken() throws Exception {
        KeyHandle key = KeyNormalizer.normalize(
                KeyMaterial.text(TestKeys.base64(TestKeys.pkcs8Pem(TestKeys.PRIMARY))));

        String token = builder.sign(Map.of("custom", "value"), key, SigningOptions.defaults()).join();

        assertThat(token.split("\\.")).hasSize(3);
        SignedJWT jwt = SignedJWT.parse(token);
        assertThat(jwt.verify(new RSASSAVerifier(TestKeys.publicKey(TestKeys.PRIMARY)))).isTrue();
        assertThat(jwt.getJWTClaimsSet().getStringClaim("custom")).isEqualTo("value");
    }

    @Test
    void pkcs1KeyVerifiesLikePkcs8Key() throws Exception {
        KeyHandle pkcs1 = KeyNormalizer.normalize(KeyMaterial.text(TestKeys.pkcs1Pem(TestKeys.PRIMARY)));
        KeyHandle pkcs8 = KeyNormalizer.normalize(KeyMaterial.text(TestKeys.pkcs8Pem(TestKeys.PRIMARY)));
        RSASSAVerifier verifier = new RSASSAVerifier(TestKeys.publicKey(TestKeys.PRIMARY));

        String fromPkcs1 = builder.sign(Map.of(), pkcs1, SigningOptions.defaults()).join();
        String fromPkcs8 = builder.sign(Map.of(), pkcs8, SigningOptions.defaults()).join();

        assertThat(SignedJWT.parse(fromPkcs1).verify(verifier)).isTrue();
        assertThat(SignedJWT.parse(fromPkcs8).verify(verifier)).isTrue();
        assertThat(fromPkcs1).isEqualTo(fromPkcs8);
    }

    @Test
    void subjectOptionReplacesPayloadSubject() throws Exception {
        KeyHandle key = KeyHandle.of(TestKeys.PRIMARY.getPrivate());
        SigningOptions options = SigningOptions.builder().subject("s").expiresIn("1h").build();

        String token = builder.sign(Map.of("sub", "x"), key, options).join();

        JWTClaimsSet claims = SignedJWT.parse(token).getJWTClaimsSet();
        assertThat(claims.getSubject()).isEqualTo("s");
        assertThat(claims.getExpirationTime()).isEqualTo(Date.from(NOW.plusSeconds(3600)));
    }

    @Test
    void payloadSubjectKeptWithoutSubjectOption() throws Exception {
        String token = builder.sign(Map.of("sub", "x"), KeyHandle.of(TestKeys.PRIMARY.getPrivate()),
                SigningOptions.defaults()).join();

        assertThat(SignedJWT.parse(token).getJWTClaimsSet().getSubject()).isEqualTo("x");
    }

    @Test
    void defaultsToRs256Header() {
        String token = builder.sign(Map.of(), KeyHandle.of(TestKeys.PRIMARY.getPrivate()), null).join();

        assertThat(JwtUtils.decodeHeader(token)).isEqualTo(Map.of("alg", "RS256"));
    }

    @Test
    void omitsStandardClaimsThatAreNotSet() {
        String token = builder.sign(Map.of("custom", 1), KeyHandle.of(TestKeys.PRIMARY.getPrivate()),
                SigningOptions.defaults()).join();

        assertThat(JwtUtils.decodeClaims(token)).containsOnlyKeys("custom");
    }

    @Test
    void appliesEveryStandardClaim() throws Exception {
        SigningOptions options = SigningOptions.builder()
                .issuer("mux")
                .subject("playback-id")
                .audience("v")
                .notBefore(NOW.minusSeconds(10))
                .expiresIn("7d")
                .kid("key-1")
                .build();

        String token = builder.sign(Map.of(), KeyHandle.of(TestKeys.PRIMARY.getPrivate()), options).join();

        Map<String, Object> claims = JwtUtils.decodeClaims(token);
        assertThat(claims)
                .containsEntry("iss", "mux")
                .containsEntry("sub", "playback-id")
                .containsEntry("aud", "v")
                .containsEntry("kid", "key-1");
        assertThat(((Number) claims.get("nbf")).longValue()).isEqualTo(NOW.getEpochSecond() - 10);
        assertThat(((Number) claims.get("exp")).longValue()).isEqualTo(NOW.getEpochSecond() + 604800);
    }

    @Test
    void multipleAudiencesSerializedAsList() {
        SigningOptions options = SigningOptions.builder().audience("a", "b").build();

        String token = builder.sign(Map.of(), KeyHandle.of(TestKeys.PRIMARY.getPrivate()), options).join();

        assertThat(JwtUtils.decodeClaims(token).get("aud")).isEqualTo(List.of("a", "b"));
    }

    @Test
    void honoursExplicitAlgorithm() throws Exception {
        SigningOptions options = SigningOptions.builder().algorithm("RS512").build();

        String token = builder.sign(Map.of(), KeyHandle.of(TestKeys.PRIMARY.getPrivate()), options).join();

        SignedJWT jwt = SignedJWT.parse(token);
        assertThat(jwt.getHeader().getAlgorithm()).isEqualTo(JWSAlgorithm.RS512);
        assertThat(jwt.verify(new RSASSAVerifier(TestKeys.publicKey(TestKeys.PRIMARY)))).isTrue();
    }

    @Test
    void algorithmKeyMismatchLeftToSigner() {
        SigningOptions options = SigningOptions.builder().algorithm("ES256").build();

        CompletableFuture<String> future = builder.sign(Map.of(), KeyHandle.of(TestKeys.PRIMARY.getPrivate()), options);

        assertThatThrownBy(future::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(SigningException.class)
                .hasCauseInstanceOf(JOSEException.class);
    }

    @Test
    void unusableAlgorithmFailsAsSigningError() {
        SigningOptions options = SigningOptions.builder().algorithm("none").build();

        CompletableFuture<String> future = builder.sign(Map.of(), KeyHandle.of(TestKeys.PRIMARY.getPrivate()), options);

        assertThatThrownBy(future::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(SigningException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void signerFailurePropagatesUnchanged() {
        SigningException failure = new SigningException("boom");
        TokenBuilder failing = new TokenBuilder((claims, header, key) -> {
            throw failure;
        }, Clock.fixed(NOW, ZoneOffset.UTC));

        CompletableFuture<String> future = failing.sign(Map.of(), KeyHandle.of(TestKeys.PRIMARY.getPrivate()),
                SigningOptions.defaults());

        assertThatThrownBy(future::join).hasCause(failure);
    }

    @Test
    void concurrentCallsDoNotShareClaimsOrKeys() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<String>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                KeyPair keyPair = i % 2 == 0 ? TestKeys.PRIMARY : TestKeys.SECONDARY;
                SigningOptions options = SigningOptions.builder().kid("key-" + i).subject("sub-" + i).build();
                futures.add(CompletableFuture.supplyAsync(
                        () -> builder.sign(Map.of("n", 0), KeyHandle.of(keyPair.getPrivate()), options).join(), pool));
            }

            for (int i = 0; i < futures.size(); i++) {
                KeyPair keyPair = i % 2 == 0 ? TestKeys.PRIMARY : TestKeys.SECONDARY;
                SignedJWT jwt = SignedJWT.parse(futures.get(i).join());
                assertThat(jwt.verify(new RSASSAVerifier(TestKeys.publicKey(keyPair)))).isTrue();
                assertThat(jwt.getJWTClaimsSet().getStringClaim("kid")).isEqualTo("key-" + i);
                assertThat(jwt.getJWTClaimsSet().getSubject()).isEqualTo("sub-" + i);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}

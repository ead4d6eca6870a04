package com.mux.sdk.jwt;

import com.nimbusds.jwt.JWTClaimsSet;

import java.time.Instant;
import java.util.Date;

/**
 * Registered claims taken from {@link SigningOptions}, applied in declaration order. Each one
 * is written only when its option is set and replaces a payload value of the same name.
 */
enum StandardClaim {
    ISSUER {
        @Override
        void apply(SigningOptions options, JWTClaimsSet.Builder claims, Instant now) {
            if (options.getIssuer() != null) {
                claims.issuer(options.getIssuer());
            }
        }
    },
    SUBJECT {
        @Override
        void apply(SigningOptions options, JWTClaimsSet.Builder claims, Instant now) {
            if (options.getSubject() != null) {
                claims.subject(options.getSubject());
            }
        }
    },
    AUDIENCE {
        @Override
        void apply(SigningOptions options, JWTClaimsSet.Builder claims, Instant now) {
            if (options.getAudience() != null && !options.getAudience().isEmpty()) {
                claims.audience(options.getAudience());
            }
        }
    },
    NOT_BEFORE {
        @Override
        void apply(SigningOptions options, JWTClaimsSet.Builder claims, Instant now) {
            if (options.getNotBefore() != null) {
                claims.notBeforeTime(Date.from(options.getNotBefore().resolve(now)));
            }
        }
    },
    EXPIRATION {
        @Override
        void apply(SigningOptions options, JWTClaimsSet.Builder claims, Instant now) {
            if (options.getExpiresIn() != null) {
                claims.expirationTime(Date.from(options.getExpiresIn().resolve(now)));
            }
        }
    };

    abstract void apply(SigningOptions options, JWTClaimsSet.Builder claims, Instant now);
}

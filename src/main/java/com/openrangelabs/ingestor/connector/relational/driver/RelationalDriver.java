package com.openrangelabs.ingestor.connector.relational.driver;

import reactor.core.publisher.Mono;

/**
 * Opens sessions against one relational backend family.
 */
public interface RelationalDriver {

    SqlDialect dialect();

    Mono<RelationalSession> open(RelationalConnectionSettings settings);
}

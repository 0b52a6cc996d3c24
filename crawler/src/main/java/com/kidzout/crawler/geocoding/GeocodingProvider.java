package com.kidzout.crawler.geocoding;

import com.kidzout.crawler.exception.GeocodeException;
import com.kidzout.crawler.model.Coordinates;
import java.util.Optional;

/**
 * External address lookup. An empty result means the provider answered but found nothing;
 * {@link GeocodeException} means it could not answer.
 */
public interface GeocodingProvider {

    Optional<Coordinates> lookup(String address) throws GeocodeException;
}

/**
 * Configuration foundation.
 *
 * <p>Configuration files are JSON5 and are read into maps by {@link com.mimecast.outpost.config.ConfigFoundation}.
 * <br>{@link com.mimecast.outpost.config.BasicConfig} adds section navigation.
 * <br>{@link com.mimecast.outpost.config.Durations} parses the {@code 30s}, {@code 5m}, {@code 1d} duration notation.
 */
package com.mimecast.outpost.config;

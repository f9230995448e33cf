/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.cspheader;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static com.cspheader.HeaderUtilities.CRLF;
import static com.cspheader.HeaderUtilities.printableString;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An ordered collection of {@link Header} instances which serializes to a header block.
 * <p>
 * Headers are kept in the order they were added, and the same field name may appear any number of times: two
 * {@link ContentSecurityPolicy} instances render as two {@code Content-Security-Policy} lines.
 * <p>
 * This class is not thread-safe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class Headers {
	@NonNull
	private static final Logger logger = Logger.getLogger(Headers.class.getName());

	@NonNull
	private final List<Header> headers;

	public Headers() {
		this.headers = new ArrayList<>();
	}

	/**
	 * Parses a header block: {@code CRLF}-separated header lines, e.g. the head of an HTTP message without its start
	 * line. Empty lines are ignored. Obsolete line folding (a line starting with whitespace) is rejected.
	 *
	 * @param headerBlock the raw header block
	 * @return the parsed headers
	 * @throws IllegalArgumentException if any line is malformed
	 */
	@NonNull
	public static Headers fromString(@NonNull String headerBlock) {
		requireNonNull(headerBlock);

		Headers headers = new Headers();

		for (String headerLine : headerBlock.split(CRLF)) {
			if (headerLine.isEmpty())
				continue;

			if (headerLine.charAt(0) == ' ' || headerLine.charAt(0) == '\t')
				throw new IllegalArgumentException(format("Folded header line '%s' is not supported", printableString(headerLine)));

			headers.addHeaderLine(headerLine);
		}

		return headers;
	}

	/**
	 * Appends {@code header} to this collection.
	 *
	 * @param header the header to add
	 * @return this collection, for chaining
	 */
	@NonNull
	public Headers addHeader(@NonNull Header header) {
		requireNonNull(header);
		this.headers.add(header);
		return this;
	}

	/**
	 * Parses {@code headerLine} and appends the result.
	 * <p>
	 * {@code Content-Security-Policy} lines become {@link ContentSecurityPolicy} instances; any other field becomes a
	 * {@link GenericHeader}.
	 *
	 * @param headerLine the raw header line
	 * @return this collection, for chaining
	 * @throws IllegalArgumentException if the line is malformed
	 */
	@NonNull
	public Headers addHeaderLine(@NonNull String headerLine) {
		requireNonNull(headerLine);

		GenericHeader genericHeader = GenericHeader.fromString(headerLine);

		if (ContentSecurityPolicy.FIELD_NAME.equalsIgnoreCase(genericHeader.getFieldName()))
			return addHeader(ContentSecurityPolicy.fromString(headerLine));

		if (logger.isLoggable(Level.FINER))
			logger.finer(format("No specialized representation for header '%s', treating as generic", genericHeader.getFieldName()));

		return addHeader(genericHeader);
	}

	/**
	 * All headers in this collection, in insertion order.
	 *
	 * @return an unmodifiable view of the headers
	 */
	@NonNull
	public List<Header> getHeaders() {
		return Collections.unmodifiableList(this.headers);
	}

	/**
	 * All headers whose field name matches {@code fieldName} (case-insensitive), in insertion order.
	 *
	 * @param fieldName the header field name
	 * @return the matching headers, possibly empty
	 */
	@NonNull
	public List<Header> getHeaders(@NonNull String fieldName) {
		requireNonNull(fieldName);

		return this.headers.stream()
				.filter(header -> header.getFieldName().equalsIgnoreCase(fieldName))
				.collect(Collectors.toUnmodifiableList());
	}

	/**
	 * Whether any header in this collection has the field name {@code fieldName} (case-insensitive).
	 *
	 * @param fieldName the header field name
	 * @return {@code true} if present, {@code false} otherwise
	 */
	@NonNull
	public Boolean has(@NonNull String fieldName) {
		requireNonNull(fieldName);
		return !getHeaders(fieldName).isEmpty();
	}

	/**
	 * The header block: each header's line followed by {@code CRLF}, in insertion order.
	 */
	@Override
	@NonNull
	public String toString() {
		StringBuilder sb = new StringBuilder();

		for (Header header : this.headers)
			sb.append(header.toString()).append(CRLF);

		return sb.toString();
	}
}

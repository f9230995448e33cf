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

import com.cspheader.HeaderUtilities.HeaderLine;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

import static com.cspheader.HeaderUtilities.assertNoLineBreaks;
import static com.cspheader.HeaderUtilities.validateHeaderName;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A header with an arbitrary name and an opaque value, for fields which have no specialized representation.
 * <p>
 * The name must be an RFC 9110 {@code token}; the value must not contain CR or LF.
 * <p>
 * This class is immutable and thread-safe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class GenericHeader implements Header {
	@NonNull
	private final String fieldName;
	@NonNull
	private final String fieldValue;

	/**
	 * Acquires a header with the given name and value.
	 *
	 * @param fieldName  the header field name
	 * @param fieldValue the header field value
	 * @return the header
	 * @throws IllegalArgumentException if the name is not a valid token or the value contains CR/LF
	 */
	@NonNull
	public static GenericHeader with(@NonNull String fieldName,
																	 @NonNull String fieldValue) {
		requireNonNull(fieldName);
		requireNonNull(fieldValue);

		// Check before trimming, which would otherwise quietly strip a trailing CRLF
		validateHeaderName(fieldName);
		assertNoLineBreaks(fieldName, fieldValue);

		return new GenericHeader(fieldName, fieldValue.trim());
	}

	/**
	 * Parses a header line of the form {@code name: value}.
	 *
	 * @param headerLine the raw header line
	 * @return the header
	 * @throws IllegalArgumentException if the line is malformed or contains CR/LF other than a trailing terminator
	 */
	@NonNull
	public static GenericHeader fromString(@NonNull String headerLine) {
		requireNonNull(headerLine);

		HeaderLine parsed = HeaderUtilities.splitHeaderLine(headerLine);
		return new GenericHeader(parsed.name(), parsed.value());
	}

	private GenericHeader(@NonNull String fieldName,
												@NonNull String fieldValue) {
		requireNonNull(fieldName);
		requireNonNull(fieldValue);

		validateHeaderName(fieldName);
		assertNoLineBreaks(fieldName, fieldValue);

		this.fieldName = fieldName;
		this.fieldValue = fieldValue;
	}

	@Override
	@NonNull
	public String getFieldName() {
		return this.fieldName;
	}

	@Override
	@NonNull
	public String getFieldValue() {
		return this.fieldValue;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s: %s", getFieldName(), getFieldValue());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof GenericHeader genericHeader))
			return false;

		return Objects.equals(getFieldName(), genericHeader.getFieldName())
				&& Objects.equals(getFieldValue(), genericHeader.getFieldValue());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getFieldName(), getFieldValue());
	}
}

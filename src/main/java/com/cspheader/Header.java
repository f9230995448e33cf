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

/**
 * Contract for a single HTTP header field: a name and a wire-format value.
 * <p>
 * Unlike most types, implementations' {@link #toString()} is <em>not</em> a debug representation: it is the full
 * header line, {@code <field-name>: <field-value>}, without a trailing {@code CRLF}. Line termination is the
 * responsibility of whoever writes the header block (see {@link Headers}).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Header {
	/**
	 * The header field name, e.g. {@code Content-Security-Policy}.
	 *
	 * @return the header field name
	 */
	@NonNull
	String getFieldName();

	/**
	 * The wire-format header field value, i.e. everything after {@code "<field-name>: "}.
	 *
	 * @return the header field value, possibly the empty string
	 */
	@NonNull
	String getFieldValue();

	/**
	 * The full header line, {@code <field-name>: <field-value>}, without a trailing {@code CRLF}.
	 *
	 * @return the header line
	 */
	@Override
	@NonNull
	String toString();
}

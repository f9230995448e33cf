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
import com.cspheader.exception.IllegalHeaderNameException;
import com.cspheader.exception.IncompatibleHeaderException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.cspheader.HeaderUtilities.CRLF;
import static com.cspheader.HeaderUtilities.assertNoLineBreaks;
import static com.cspheader.HeaderUtilities.printableString;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@code Content-Security-Policy} header representation: an ordered mapping of {@link Directive} names to their
 * source lists, e.g. {@code default-src 'self'; img-src 'self' https://*.gravatar.com;}.
 * <p>
 * Instances are acquired by parsing a header line via {@link #fromString(String)} or by constructing an empty
 * policy and populating it with {@link #setDirective(String, List)}:
 * <pre>{@code
 * ContentSecurityPolicy csp = new ContentSecurityPolicy()
 *     .setDirective("default-src", List.of("'self'"))
 *     .setDirective("img-src", List.of("'self'", "https://*.gravatar.com"));
 *
 * // csp.toString() =>
 * // Content-Security-Policy: default-src 'self'; img-src 'self' https://*.gravatar.com;
 * }</pre>
 * Directives are rendered in the order they were first set. No stored name or source token ever contains a CR or
 * LF character.
 * <p>
 * This class is not thread-safe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class ContentSecurityPolicy implements MultipleHeader {
	/**
	 * The header field name, {@code Content-Security-Policy}.
	 */
	@NonNull
	public static final String FIELD_NAME = "Content-Security-Policy";

	/**
	 * The source list stored for a directive that was set with no sources.
	 */
	@NonNull
	public static final String NONE_SOURCE = "'none'";

	@NonNull
	private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

	@NonNull
	private final Map<String, List<String>> directives;

	/**
	 * Creates a policy with no directives.
	 */
	public ContentSecurityPolicy() {
		this.directives = new LinkedHashMap<>();
	}

	/**
	 * Parses a header line of the form {@code Content-Security-Policy: directive1 src1 src2; directive2 src1;}.
	 * <p>
	 * Field name comparison is case-insensitive. Empty clauses are ignored and a directive which appears more than once
	 * keeps its position from the first occurrence but takes the sources of the last. A single trailing {@code CRLF}
	 * is tolerated; any other CR or LF is rejected.
	 *
	 * @param headerLine the raw header line
	 * @return the parsed policy
	 * @throws IllegalHeaderNameException if the field name is not {@code Content-Security-Policy}
	 * @throws IllegalArgumentException   if the line is malformed, contains CR/LF, or names an unknown directive
	 */
	@NonNull
	public static ContentSecurityPolicy fromString(@NonNull String headerLine) {
		requireNonNull(headerLine);

		HeaderLine parsed = HeaderUtilities.splitHeaderLine(headerLine);

		if (!FIELD_NAME.equalsIgnoreCase(parsed.name()))
			throw new IllegalHeaderNameException(format("Invalid header line for %s string: '%s'",
					FIELD_NAME, printableString(parsed.name())), parsed.name());

		ContentSecurityPolicy contentSecurityPolicy = new ContentSecurityPolicy();

		for (String clause : parsed.value().split(";")) {
			clause = clause.trim();

			if (clause.isEmpty())
				continue;

			String[] tokens = WHITESPACE_PATTERN.split(clause);
			contentSecurityPolicy.setDirective(tokens[0], Arrays.asList(tokens).subList(1, tokens.length));
		}

		return contentSecurityPolicy;
	}

	/**
	 * Replaces the source list for the directive named {@code name}.
	 * <p>
	 * An empty {@code sources} list is stored as {@code 'none'}, with one exception: an empty {@code report-uri}
	 * removes that directive entirely. Validation happens before anything is modified.
	 *
	 * @param name    the directive name, e.g. {@code script-src}
	 * @param sources the directive's source tokens, in output order
	 * @return this policy, for chaining
	 * @throws IllegalArgumentException if {@code name} is not a permitted directive or any source contains CR/LF
	 */
	@NonNull
	public ContentSecurityPolicy setDirective(@NonNull String name,
																						@NonNull List<String> sources) {
		requireNonNull(name);
		requireNonNull(sources);

		Directive directive = Directive.fromName(name).orElseThrow(() ->
				new IllegalArgumentException(format("%s expects a valid directive name; received '%s'", getClass().getSimpleName(), printableString(name))));

		for (String source : sources) {
			requireNonNull(source);
			assertNoLineBreaks(FIELD_NAME, source);
		}

		if (sources.isEmpty()) {
			if (directive == Directive.REPORT_URI)
				this.directives.remove(name);
			else
				this.directives.put(name, List.of(NONE_SOURCE));

			return this;
		}

		this.directives.put(name, List.copyOf(sources));
		return this;
	}

	/**
	 * Convenience for {@link #setDirective(String, List)} using a {@link Directive} constant.
	 *
	 * @param directive the directive to set
	 * @param sources   the directive's source tokens, in output order
	 * @return this policy, for chaining
	 */
	@NonNull
	public ContentSecurityPolicy setDirective(@NonNull Directive directive,
																						@NonNull String... sources) {
		requireNonNull(directive);
		requireNonNull(sources);

		return setDirective(directive.getName(), Arrays.asList(sources));
	}

	/**
	 * The directives of this policy, in output order.
	 * <p>
	 * The returned map and its lists are unmodifiable views.
	 *
	 * @return the directive mapping
	 */
	@NonNull
	public Map<String, List<String>> getDirectives() {
		return Collections.unmodifiableMap(this.directives);
	}

	/**
	 * The source list for the directive named {@code name}, if set.
	 *
	 * @param name the directive name
	 * @return the source list, or {@link Optional#empty()} if the directive is not set
	 */
	@NonNull
	public Optional<List<String>> getDirective(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.directives.get(name));
	}

	@Override
	@NonNull
	public String getFieldName() {
		return FIELD_NAME;
	}

	/**
	 * Renders each directive as {@code name src1 src2;}, space-separated, e.g.
	 * {@code default-src 'self'; img-src https://*.github.com;}. An empty policy renders as the empty string.
	 */
	@Override
	@NonNull
	public String getFieldValue() {
		List<String> clauses = new ArrayList<>(this.directives.size());

		for (Entry<String, List<String>> entry : this.directives.entrySet())
			clauses.add(format("%s %s;", entry.getKey(), String.join(" ", entry.getValue())));

		return String.join(" ", clauses);
	}

	/**
	 * @throws IncompatibleHeaderException if any of {@code headers} is not a {@link ContentSecurityPolicy}
	 */
	@Override
	@NonNull
	public String toStringMultipleHeaders(@NonNull Header... headers) {
		requireNonNull(headers);

		for (Header header : headers) {
			requireNonNull(header);

			if (!(header instanceof ContentSecurityPolicy))
				throw new IncompatibleHeaderException(format("The %s multiple header implementation can only accept an array of %s headers",
						getClass().getSimpleName(), getClass().getSimpleName()), ContentSecurityPolicy.class, header.getClass());
		}

		StringBuilder sb = new StringBuilder(toString()).append(CRLF);

		for (Header header : headers)
			sb.append(header.toString()).append(CRLF);

		return sb.toString();
	}

	/**
	 * The header line, e.g. {@code Content-Security-Policy: default-src 'none';}. An empty policy yields
	 * {@code "Content-Security-Policy: "}.
	 */
	@Override
	@NonNull
	public String toString() {
		return format("%s: %s", getFieldName(), getFieldValue());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ContentSecurityPolicy contentSecurityPolicy))
			return false;

		// Directive order is part of the wire format, so compare as ordered entry lists
		return Objects.equals(new ArrayList<>(this.directives.entrySet()), new ArrayList<>(contentSecurityPolicy.directives.entrySet()));
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.directives);
	}
}

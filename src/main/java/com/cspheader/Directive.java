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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The directive names permitted in a {@code Content-Security-Policy} header.
 * <p>
 * See <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Content-Security-Policy">https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Content-Security-Policy</a> for details.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum Directive {
	BASE_URI("base-uri"),
	BLOCK_ALL_MIXED_CONTENT("block-all-mixed-content"),
	CHILD_SRC("child-src"),
	CONNECT_SRC("connect-src"),
	DEFAULT_SRC("default-src"),
	FONT_SRC("font-src"),
	FORM_ACTION("form-action"),
	FRAME_ANCESTORS("frame-ancestors"),
	FRAME_SRC("frame-src"),
	IMG_SRC("img-src"),
	MANIFEST_SRC("manifest-src"),
	MEDIA_SRC("media-src"),
	NAVIGATE_TO("navigate-to"),
	OBJECT_SRC("object-src"),
	PLUGIN_TYPES("plugin-types"),
	PREFETCH_SRC("prefetch-src"),
	REPORT_TO("report-to"),
	/**
	 * Unlike every other directive, setting {@code report-uri} to an empty source list removes it.
	 */
	REPORT_URI("report-uri"),
	REQUIRE_SRI_FOR("require-sri-for"),
	REQUIRE_TRUSTED_TYPES_FOR("require-trusted-types-for"),
	SANDBOX("sandbox"),
	SCRIPT_SRC("script-src"),
	SCRIPT_SRC_ATTR("script-src-attr"),
	SCRIPT_SRC_ELEM("script-src-elem"),
	STYLE_SRC("style-src"),
	STYLE_SRC_ATTR("style-src-attr"),
	STYLE_SRC_ELEM("style-src-elem"),
	TRUSTED_TYPES("trusted-types"),
	UPGRADE_INSECURE_REQUESTS("upgrade-insecure-requests"),
	WORKER_SRC("worker-src");

	@NonNull
	private static final Map<String, Directive> DIRECTIVES_BY_NAME;

	static {
		Map<String, Directive> directivesByName = new LinkedHashMap<>();

		for (Directive directive : values())
			directivesByName.put(directive.getName(), directive);

		DIRECTIVES_BY_NAME = Collections.unmodifiableMap(directivesByName);
	}

	@NonNull
	private final String name;

	Directive(@NonNull String name) {
		requireNonNull(name);
		this.name = name;
	}

	/**
	 * Returns the {@link Directive} whose wire name exactly matches {@code name} (case-sensitive).
	 *
	 * @param name a directive name, e.g. {@code default-src}
	 * @return the matching directive, or {@link Optional#empty()} if {@code name} is not permitted
	 */
	@NonNull
	public static Optional<Directive> fromName(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(DIRECTIVES_BY_NAME.get(name));
	}

	/**
	 * The directive name as it appears on the wire, e.g. {@code default-src}.
	 *
	 * @return the directive name
	 */
	@NonNull
	public String getName() {
		return this.name;
	}
}

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

import com.cspheader.exception.IllegalHeaderNameException;
import com.cspheader.exception.IllegalHeaderValueException;
import com.cspheader.exception.IncompatibleHeaderException;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ContentSecurityPolicyTests {
	@Test
	public void fromStringRejectsImproperHeaderName() {
		IllegalHeaderNameException exception = assertThrows(IllegalHeaderNameException.class,
				() -> ContentSecurityPolicy.fromString("X-Content-Security-Policy: default-src *;"));

		assertEquals("X-Content-Security-Policy", exception.getHeaderName());
	}

	@Test
	public void fromStringRejectsLineWithoutColon() {
		assertThrows(IllegalArgumentException.class,
				() -> ContentSecurityPolicy.fromString("Content-Security-Policy default-src *;"));
	}

	@Test
	public void fromStringAcceptsDifferentlyCasedHeaderName() {
		ContentSecurityPolicy csp = ContentSecurityPolicy.fromString("content-security-policy: default-src 'self';");
		assertEquals(Map.of("default-src", List.of("'self'")), csp.getDirectives());
	}

	@Test
	public void fromStringParsesDirectivesCorrectly() {
		ContentSecurityPolicy csp = ContentSecurityPolicy.fromString(
				"Content-Security-Policy: default-src 'none'; script-src 'self'; img-src 'self'; style-src 'self';");

		assertTrue(csp instanceof MultipleHeader);
		assertTrue(csp instanceof Header);

		Map<String, List<String>> expected = new LinkedHashMap<>();
		expected.put("default-src", List.of("'none'"));
		expected.put("script-src", List.of("'self'"));
		expected.put("img-src", List.of("'self'"));
		expected.put("style-src", List.of("'self'"));

		assertEquals(expected, csp.getDirectives());
		assertEquals(List.of("default-src", "script-src", "img-src", "style-src"), List.copyOf(csp.getDirectives().keySet()),
				"Directive order was not preserved");
	}

	@Test
	public void fromStringSplitsSourcesOnWhitespace() {
		ContentSecurityPolicy csp = ContentSecurityPolicy.fromString(
				"Content-Security-Policy:   img-src  'self'\thttps://*.gravatar.com ;;  ; script-src 'self'");

		assertEquals(Optional.of(List.of("'self'", "https://*.gravatar.com")), csp.getDirective("img-src"));
		assertEquals(Optional.of(List.of("'self'")), csp.getDirective("script-src"));
		assertEquals(2, csp.getDirectives().size());
	}

	@Test
	public void fromStringLastOccurrenceWins() {
		ContentSecurityPolicy csp = ContentSecurityPolicy.fromString(
				"Content-Security-Policy: default-src 'self'; img-src *; default-src 'none';");

		assertEquals("default-src 'none'; img-src *;", csp.getFieldValue());
	}

	@Test
	public void fromStringRejectsUnknownDirective() {
		assertThrows(IllegalArgumentException.class,
				() -> ContentSecurityPolicy.fromString("Content-Security-Policy: default-src 'self'; foo-src 'self';"));
	}

	@Test
	public void fromStringWithEmptyValueYieldsEmptyPolicy() {
		ContentSecurityPolicy csp = ContentSecurityPolicy.fromString("Content-Security-Policy:");
		assertTrue(csp.getDirectives().isEmpty());
		assertEquals("Content-Security-Policy: ", csp.toString());
	}

	@Test
	public void fromStringWithDirectiveLackingSourcesDefaultsToNone() {
		ContentSecurityPolicy csp = ContentSecurityPolicy.fromString("Content-Security-Policy: object-src; report-uri;");
		assertEquals("Content-Security-Policy: object-src 'none';", csp.toString());
	}

	@Test
	public void getFieldNameReturnsHeaderName() {
		assertEquals("Content-Security-Policy", new ContentSecurityPolicy().getFieldName());
	}

	@Test
	public void toStringReturnsHeaderFormattedString() {
		ContentSecurityPolicy csp = ContentSecurityPolicy.fromString(
				"Content-Security-Policy: default-src 'none'; img-src 'self' https://*.gravatar.com;");

		assertEquals("Content-Security-Policy: default-src 'none'; img-src 'self' https://*.gravatar.com;", csp.toString());
	}

	@Test
	public void setDirective() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy();
		csp.setDirective("default-src", List.of("https://*.google.com", "http://foo.com"))
				.setDirective("img-src", List.of("'self'"))
				.setDirective("script-src", List.of("https://*.googleapis.com", "https://*.bar.com"));

		assertEquals("Content-Security-Policy: default-src https://*.google.com http://foo.com; "
				+ "img-src 'self'; script-src https://*.googleapis.com https://*.bar.com;", csp.toString());
	}

	@Test
	public void setDirectiveReturnsSameInstance() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy();
		assertSame(csp, csp.setDirective("default-src", List.of("'self'")));
		assertSame(csp, csp.setDirective(Directive.IMG_SRC, "*"));
	}

	@Test
	public void setDirectiveWithEnumConstant() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy()
				.setDirective(Directive.DEFAULT_SRC, "'self'")
				.setDirective(Directive.FRAME_ANCESTORS);

		assertEquals("default-src 'self'; frame-ancestors 'none';", csp.getFieldValue());
	}

	@Test
	public void setDirectiveWithEmptySourcesDefaultsToNone() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy();
		csp.setDirective("default-src", List.of("'self'"))
				.setDirective("img-src", List.of("*"))
				.setDirective("script-src", List.of());

		assertEquals("Content-Security-Policy: default-src 'self'; img-src *; script-src 'none';", csp.toString());
	}

	@Test
	public void setDirectiveReplacesExistingSourcesInPlace() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy()
				.setDirective("img-src", List.of("*"))
				.setDirective("script-src", List.of("'self'"))
				.setDirective("img-src", List.of());

		assertEquals("img-src 'none'; script-src 'self';", csp.getFieldValue());
	}

	@Test
	public void setDirectiveRejectsInvalidDirectiveName() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy();
		assertThrows(IllegalArgumentException.class, () -> csp.setDirective("foo", List.of()));
		assertThrows(IllegalArgumentException.class, () -> csp.setDirective("Default-Src", List.of("'self'")));
		assertTrue(csp.getDirectives().isEmpty());
	}

	@Test
	public void getFieldValueReturnsProperValue() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy();
		csp.setDirective("default-src", List.of("'self'"))
				.setDirective("img-src", List.of("https://*.github.com"));

		assertEquals("default-src 'self'; img-src https://*.github.com;", csp.getFieldValue());
	}

	@Test
	public void preventsCrlfAttackViaFromString() {
		assertThrows(IllegalHeaderValueException.class,
				() -> ContentSecurityPolicy.fromString("Content-Security-Policy: default-src 'none'\r\n\r\nevilContent"));
		assertThrows(IllegalArgumentException.class,
				() -> ContentSecurityPolicy.fromString("Content-Security-Policy: default-src 'none'\nscript-src *;"));
		assertThrows(IllegalArgumentException.class,
				() -> ContentSecurityPolicy.fromString("Content-Security-Policy: default-src 'none';\r"));
		assertThrows(IllegalArgumentException.class,
				() -> ContentSecurityPolicy.fromString("Content-Security-Policy: default-src 'none';\r\n\r\n"));
	}

	@Test
	public void fromStringToleratesSingleTrailingLineTerminator() {
		ContentSecurityPolicy csp = ContentSecurityPolicy.fromString("Content-Security-Policy: default-src 'none';\r\n");
		assertEquals("Content-Security-Policy: default-src 'none';", csp.toString());
	}

	@Test
	public void preventsCrlfAttackViaDirective() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy();
		assertThrows(IllegalHeaderValueException.class,
				() -> csp.setDirective("default-src", List.of("\rsome\r\nCRLF\ninjection")));
		assertThrows(IllegalHeaderValueException.class,
				() -> csp.setDirective("default-src", List.of("'self'", "evil\n")));
	}

	@Test
	public void rejectedDirectiveLeavesPolicyUntouched() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy().setDirective("default-src", List.of("'self'"));

		assertThrows(IllegalArgumentException.class,
				() -> csp.setDirective("default-src", List.of("https://ok.example", "bad\r\n")));

		assertEquals("default-src 'self';", csp.getFieldValue());
	}

	@Test
	public void setDirectiveWithEmptyReportUriDefaultsToUnset() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy();
		csp.setDirective("report-uri", List.of());

		assertEquals("Content-Security-Policy: ", csp.toString());
	}

	@Test
	public void setDirectiveWithEmptyReportUriRemovesExistingValue() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy();
		csp.setDirective("report-uri", List.of("csp-error"));
		assertEquals("Content-Security-Policy: report-uri csp-error;", csp.toString());

		csp.setDirective("report-uri", List.of());
		assertEquals("Content-Security-Policy: ", csp.toString());
		assertFalse(csp.getDirective("report-uri").isPresent());
	}

	@Test
	public void getDirectivesIsUnmodifiable() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy().setDirective("default-src", List.of("'self'"));

		assertThrows(UnsupportedOperationException.class, () -> csp.getDirectives().put("img-src", List.of("*")));
		assertThrows(UnsupportedOperationException.class, () -> csp.getDirectives().get("default-src").add("*"));
	}

	@Test
	public void roundTripReproducesDirectives() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy()
				.setDirective("default-src", List.of("'self'"))
				.setDirective("img-src", List.of("'self'", "data:", "https://*.example.com"))
				.setDirective("object-src", List.of())
				.setDirective("report-uri", List.of("/csp-report"));

		ContentSecurityPolicy reparsed = ContentSecurityPolicy.fromString(csp.toString());

		assertEquals(csp.getDirectives(), reparsed.getDirectives());
		assertEquals(csp, reparsed);
		assertEquals(csp.hashCode(), reparsed.hashCode());
		assertEquals(csp.toString(), reparsed.toString());
	}

	@Test
	public void equalityRespectsDirectiveOrder() {
		ContentSecurityPolicy first = new ContentSecurityPolicy()
				.setDirective("default-src", List.of("'self'"))
				.setDirective("img-src", List.of("*"));
		ContentSecurityPolicy second = new ContentSecurityPolicy()
				.setDirective("img-src", List.of("*"))
				.setDirective("default-src", List.of("'self'"));

		assertNotEquals(first, second);
	}

	@Test
	public void toStringMultipleHeaders() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy();
		csp.setDirective("default-src", List.of("'self'"));

		ContentSecurityPolicy additional = new ContentSecurityPolicy();
		additional.setDirective("img-src", List.of("https://*.github.com"));

		String expected = "Content-Security-Policy: default-src 'self';\r\n"
				+ "Content-Security-Policy: img-src https://*.github.com;\r\n";

		assertEquals(expected, csp.toStringMultipleHeaders(additional));
		assertEquals(expected, csp.toStringMultipleHeaders(List.of(additional)));
	}

	@Test
	public void toStringMultipleHeadersWithNoAdditionalHeaders() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy().setDirective("default-src", List.of("'self'"));
		assertEquals("Content-Security-Policy: default-src 'self';\r\n", csp.toStringMultipleHeaders());
	}

	@Test
	public void toStringMultipleHeadersRejectsDifferentHeaderType() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy();
		csp.setDirective("default-src", List.of("'self'"));

		GenericHeader additional = GenericHeader.with("X-Frame-Options", "DENY");

		IncompatibleHeaderException exception = assertThrows(IncompatibleHeaderException.class,
				() -> csp.toStringMultipleHeaders(additional));

		assertEquals("The ContentSecurityPolicy multiple header implementation"
				+ " can only accept an array of ContentSecurityPolicy headers", exception.getMessage());
		assertEquals(ContentSecurityPolicy.class, exception.getExpectedType());
		assertEquals(GenericHeader.class, exception.getActualType());
	}

	@Test
	public void toStringMultipleHeadersRejectsGenericHeaderWithSameName() {
		ContentSecurityPolicy csp = new ContentSecurityPolicy().setDirective("default-src", List.of("'self'"));
		GenericHeader impostor = GenericHeader.with("Content-Security-Policy", "img-src *;");

		assertThrows(IncompatibleHeaderException.class, () -> csp.toStringMultipleHeaders(List.of(impostor)));
	}
}

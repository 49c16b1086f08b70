package org.springaicommunity.credentialforge;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Produces strings matching a regular expression.
 *
 * <p>
 * Supports the subset of regex syntax used by credential patterns: literals and escapes,
 * character classes with ranges, {@code \d \w \s}, {@code .}, capturing and non-capturing
 * groups with alternation, and the quantifiers {@code * + ? {n} {n,} {n,m}}. Anchors and
 * word boundaries produce nothing. Negated classes and lookaround are rejected.
 *
 * <p>
 * The pattern is parsed once; {@link #generate(Random)} may be called repeatedly.
 */
final class RegexValueGenerator {

	private static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

	private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";

	private static final String DIGITS = "0123456789";

	private static final String ALNUM = UPPER + LOWER + DIGITS;

	// upper bound added to open-ended quantifiers
	private static final int OPEN_REPEAT = 8;

	private final String regex;

	private final Node root;

	private int pos;

	private RegexValueGenerator(String regex) {
		this.regex = regex;
		this.root = parseAlternation();
		if (pos < regex.length()) {
			throw error("unbalanced ')'");
		}
	}

	/**
	 * Parse a regular expression.
	 * @param regex the expression
	 * @return a generator for it
	 * @throws IllegalArgumentException if the expression uses unsupported syntax
	 */
	static RegexValueGenerator compile(String regex) {
		return new RegexValueGenerator(regex);
	}

	String generate(Random random) {
		StringBuilder out = new StringBuilder();
		root.render(out, random);
		return out.toString();
	}

	private Node parseAlternation() {
		List<Node> branches = new ArrayList<>();
		branches.add(parseSequence());
		while (pos < regex.length() && regex.charAt(pos) == '|') {
			pos++;
			branches.add(parseSequence());
		}
		return branches.size() == 1 ? branches.get(0) : new Alternation(branches);
	}

	private Node parseSequence() {
		List<Node> nodes = new ArrayList<>();
		while (pos < regex.length() && regex.charAt(pos) != '|' && regex.charAt(pos) != ')') {
			Node atom = parseAtom();
			nodes.add(parseQuantifier(atom));
		}
		return new Sequence(nodes);
	}

	private Node parseAtom() {
		char c = regex.charAt(pos++);
		switch (c) {
			case '(':
				if (regex.startsWith("?:", pos)) {
					pos += 2;
				}
				else if (pos < regex.length() && regex.charAt(pos) == '?') {
					throw error("lookaround and named groups are not supported");
				}
				Node group = parseAlternation();
				if (pos >= regex.length() || regex.charAt(pos) != ')') {
					throw error("missing ')'");
				}
				pos++;
				return group;
			case '[':
				return parseClass();
			case '.':
				return new CharSet(ALNUM);
			case '^':
			case '$':
				return new Literal("");
			case '\\':
				return parseEscape(false);
			default:
				return new Literal(String.valueOf(c));
		}
	}

	private Node parseEscape(boolean inClass) {
		if (pos >= regex.length()) {
			throw error("trailing backslash");
		}
		char c = regex.charAt(pos++);
		switch (c) {
			case 'd':
				return new CharSet(DIGITS);
			case 'w':
				return new CharSet(ALNUM + "_");
			case 's':
				return new CharSet(" ");
			case 'b':
			case 'B':
				if (inClass) {
					throw error("backspace escape in class");
				}
				return new Literal("");
			case 'D':
			case 'W':
			case 'S':
				throw error("negated escape \\" + c + " is not supported");
			case 'n':
				return new Literal("\n");
			case 't':
				return new Literal("\t");
			default:
				return new Literal(String.valueOf(c));
		}
	}

	private Node parseClass() {
		if (pos < regex.length() && regex.charAt(pos) == '^') {
			throw error("negated character classes are not supported");
		}
		Set<Character> chars = new LinkedHashSet<>();
		boolean first = true;
		while (pos < regex.length() && (regex.charAt(pos) != ']' || first)) {
			first = false;
			char c = regex.charAt(pos++);
			if (c == '\\') {
				Node escaped = parseEscape(true);
				if (escaped instanceof CharSet) {
					addAll(chars, ((CharSet) escaped).chars());
					continue;
				}
				c = ((Literal) escaped).text().charAt(0);
			}
			if (pos + 1 < regex.length() && regex.charAt(pos) == '-' && regex.charAt(pos + 1) != ']') {
				pos++;
				char end = regex.charAt(pos++);
				if (end == '\\') {
					end = ((Literal) parseEscape(true)).text().charAt(0);
				}
				if (end < c) {
					throw error("invalid range " + c + "-" + end);
				}
				for (char r = c; r <= end; r++) {
					chars.add(r);
				}
			}
			else {
				chars.add(c);
			}
		}
		if (pos >= regex.length()) {
			throw error("missing ']'");
		}
		pos++;
		StringBuilder set = new StringBuilder();
		chars.forEach(set::append);
		return new CharSet(set.toString());
	}

	private Node parseQuantifier(Node atom) {
		if (pos >= regex.length()) {
			return atom;
		}
		char c = regex.charAt(pos);
		Node quantified;
		switch (c) {
			case '*':
				pos++;
				quantified = new Repeat(atom, 0, OPEN_REPEAT);
				break;
			case '+':
				pos++;
				quantified = new Repeat(atom, 1, 1 + OPEN_REPEAT);
				break;
			case '?':
				pos++;
				quantified = new Repeat(atom, 0, 1);
				break;
			case '{':
				quantified = parseBraces(atom);
				break;
			default:
				return atom;
		}
		// lazy and possessive suffixes do not change what matches
		if (pos < regex.length() && (regex.charAt(pos) == '?' || regex.charAt(pos) == '+')) {
			pos++;
		}
		return quantified;
	}

	private Node parseBraces(Node atom) {
		int close = regex.indexOf('}', pos);
		if (close < 0) {
			throw error("missing '}'");
		}
		String body = regex.substring(pos + 1, close);
		pos = close + 1;
		try {
			int comma = body.indexOf(',');
			if (comma < 0) {
				int n = Integer.parseInt(body.trim());
				return new Repeat(atom, n, n);
			}
			int min = Integer.parseInt(body.substring(0, comma).trim());
			String maxText = body.substring(comma + 1).trim();
			int max = maxText.isEmpty() ? min + OPEN_REPEAT : Integer.parseInt(maxText);
			if (max < min) {
				throw error("invalid quantifier {" + body + "}");
			}
			return new Repeat(atom, min, max);
		}
		catch (NumberFormatException e) {
			throw error("invalid quantifier {" + body + "}");
		}
	}

	private IllegalArgumentException error(String message) {
		return new IllegalArgumentException("Cannot generate from pattern '" + regex + "': " + message);
	}

	private static void addAll(Set<Character> target, String chars) {
		for (int i = 0; i < chars.length(); i++) {
			target.add(chars.charAt(i));
		}
	}

	private interface Node {

		void render(StringBuilder out, Random random);

	}

	private record Literal(String text) implements Node {

		@Override
		public void render(StringBuilder out, Random random) {
			out.append(text);
		}

	}

	private record CharSet(String chars) implements Node {

		@Override
		public void render(StringBuilder out, Random random) {
			out.append(chars.charAt(random.nextInt(chars.length())));
		}

	}

	private record Sequence(List<Node> nodes) implements Node {

		@Override
		public void render(StringBuilder out, Random random) {
			for (Node node : nodes) {
				node.render(out, random);
			}
		}

	}

	private record Alternation(List<Node> branches) implements Node {

		@Override
		public void render(StringBuilder out, Random random) {
			branches.get(random.nextInt(branches.size())).render(out, random);
		}

	}

	private record Repeat(Node node, int min, int max) implements Node {

		@Override
		public void render(StringBuilder out, Random random) {
			int count = min + random.nextInt(max - min + 1);
			for (int i = 0; i < count; i++) {
				node.render(out, random);
			}
		}

	}

}

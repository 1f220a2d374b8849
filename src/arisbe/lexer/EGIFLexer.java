package arisbe.lexer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import arisbe.util.SourceLocation;

/**
 * A single left-to-right scan of EGIF text into tokens, with no backtracking.
 *
 * Whether a bare name is a relation name or a bound variable is decided by the token before it: a name
 * directly after "(" names the relation, any other bare name refers to a variable.
 *
 * Comments are not the lexer's business; run {@link #stripComments(String)} over the text first.
 */
public class EGIFLexer {

	static final Pattern WHITESPACE = Pattern.compile("\\s+");
	static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
	static final Pattern DEFINING = Pattern.compile("\\*([A-Za-z_][A-Za-z0-9_]*)");

	private final Path filename;
	private final String text;
	private final int[] lineStarts;

	public EGIFLexer(Path filename, String text) {
		this.filename = filename;
		this.text = text;
		this.lineStarts = computeLineStarts(text);
	}

	public EGIFLexer(String text) {
		this(null, text);
	}

	/**
	 * Replaces every comment (from a '#' outside a quoted name to the end of its line) with spaces. Offsets in
	 * the result match offsets in the input, so locations reported later still point into the caller's text.
	 * Lines left blank are whitespace and produce no tokens.
	 */
	public static String stripComments(String text) {
		char[] chars = text.toCharArray();
		boolean inQuote = false;
		boolean inComment = false;
		for(int i = 0; i < chars.length; ++i) {
			char c = chars[i];
			if(inComment) {
				if(c == '\n') {
					inComment = false;
				}else if(c != '\r') {
					chars[i] = ' ';
				}
			}else if(inQuote) {
				if(c == '\\') {
					++i;
				}else if(c == '"') {
					inQuote = false;
				}
			}else if(c == '"') {
				inQuote = true;
			}else if(c == '#') {
				inComment = true;
				chars[i] = ' ';
			}
		}
		return new String(chars);
	}

	private static int[] computeLineStarts(String text) {
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for(int i = 0; i < text.length(); ++i) {
			if(text.charAt(i) == '\n') {
				starts.add(i + 1);
			}
		}
		return starts.stream().mapToInt(Integer::intValue).toArray();
	}

	private SourceLocation locate(int start, int end) {
		int line = Arrays.binarySearch(lineStarts, start);
		if(line < 0) {
			line = -line - 2;
		}
		return new SourceLocation(filename, start, end, line + 1, start - lineStarts[line] + 1);
	}

	private EGIFToken makeToken(String value, EGIFTokenType type, int start, int end) {
		return new EGIFToken(value, type, locate(start, end));
	}

	private LexIssue error(int offset, String reason) {
		char c = offset < text.length() ? text.charAt(offset) : '\0';
		return new LexIssue(c, reason, locate(offset, offset + 1));
	}

	/**
	 * @return the tokens of the text, always ending in a single EOF token
	 * @throws LexIssue at the first character that cannot start a token
	 */
	public List<EGIFToken> readTokens() {
		List<EGIFToken> tokens = new ArrayList<>();
		int pos = 0;
		while(pos < text.length()) {
			Matcher m = WHITESPACE.matcher(text);
			m.region(pos, text.length());
			if(m.lookingAt()) {
				pos = m.end();
				continue;
			}
			char c = text.charAt(pos);
			switch(c) {
				case '(':
					tokens.add(makeToken("(", EGIFTokenType.LPAREN, pos, pos + 1));
					++pos;
					continue;
				case ')':
					tokens.add(makeToken(")", EGIFTokenType.RPAREN, pos, pos + 1));
					++pos;
					continue;
				case '[':
					tokens.add(makeToken("[", EGIFTokenType.LBRACKET, pos, pos + 1));
					++pos;
					continue;
				case ']':
					tokens.add(makeToken("]", EGIFTokenType.RBRACKET, pos, pos + 1));
					++pos;
					continue;
				case '=':
					tokens.add(makeToken("=", EGIFTokenType.IDENTIFIER, pos, pos + 1));
					++pos;
					continue;
				case '~':
					if(pos + 1 < text.length() && text.charAt(pos + 1) == '[') {
						tokens.add(makeToken("~[", EGIFTokenType.CUT_OPEN, pos, pos + 2));
						pos += 2;
						continue;
					}
					throw error(pos, "'~' must be followed by '['");
				case '*':
					m = DEFINING.matcher(text);
					m.region(pos, text.length());
					if(m.lookingAt()) {
						tokens.add(makeToken(m.group(1), EGIFTokenType.DEFINING_VARIABLE, pos, m.end()));
						pos = m.end();
						continue;
					}
					throw error(pos, "'*' must be followed by a name");
				case '"':
					pos = readConstant(tokens, pos);
					continue;
				default:
					break;
			}
			m = NAME.matcher(text);
			m.region(pos, text.length());
			if(m.lookingAt()) {
				boolean afterParen = !tokens.isEmpty() &&
						tokens.get(tokens.size() - 1).getType() == EGIFTokenType.LPAREN;
				EGIFTokenType type = afterParen ? EGIFTokenType.IDENTIFIER : EGIFTokenType.BOUND_VARIABLE;
				tokens.add(makeToken(m.group(), type, pos, m.end()));
				pos = m.end();
				continue;
			}
			throw error(pos, "unexpected character");
		}
		tokens.add(makeToken("", EGIFTokenType.EOF, text.length(), text.length()));
		return tokens;
	}

	private int readConstant(List<EGIFToken> tokens, int start) {
		StringBuilder value = new StringBuilder();
		int pos = start + 1;
		while(pos < text.length()) {
			char c = text.charAt(pos);
			if(c == '"') {
				tokens.add(makeToken(value.toString(), EGIFTokenType.CONSTANT, start, pos + 1));
				return pos + 1;
			}
			if(c == '\\') {
				if(pos + 1 >= text.length()) {
					break;
				}
				value.append(text.charAt(pos + 1));
				pos += 2;
			}else {
				value.append(c);
				++pos;
			}
		}
		throw error(start, "unterminated quoted name");
	}
}

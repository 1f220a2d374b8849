package arisbe.lexer;

public enum EGIFTokenType {
	LPAREN,
	RPAREN,
	LBRACKET,
	RBRACKET,
	// "~[", the opening of a cut; a cut is closed by an ordinary RBRACKET
	CUT_OPEN,
	// "*x"; the token value is the bare name
	DEFINING_VARIABLE,
	// a bare name anywhere except directly after "("
	BOUND_VARIABLE,
	// a quoted name; the token value has the quotes removed and escapes resolved
	CONSTANT,
	// a bare name directly after "(", or "="
	IDENTIFIER,
	EOF,
}

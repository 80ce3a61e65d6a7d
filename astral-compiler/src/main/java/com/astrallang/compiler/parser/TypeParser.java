package com.astrallang.compiler.parser;

import com.astrallang.compiler.lexer.Token;

import static com.astrallang.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类，类型以规范化的字符串表示：int、[int; 3]、&string、&mut Point
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    String parseType() {
        if (parser.match(AMPERSAND)) {
            boolean mutable = parser.match(KW_MUT);
            String inner = parseType();
            return mutable ? "&mut " + inner : "&" + inner;
        }
        if (parser.match(LBRACKET)) {
            String element = parseType();
            parser.expect(SEMICOLON, "Expected ';' in array type");
            Token size = parser.expect(INT_LITERAL, "Expected array length");
            parser.expect(RBRACKET, "Expected ']' after array type");
            return "[" + element + "; " + size.getLiteral() + "]";
        }
        if (parser.current.getType().isBuiltinType() || parser.check(IDENTIFIER)) {
            return parser.advance().getLexeme();
        }
        throw new ParseException("Expected type", parser.current, "type");
    }
}

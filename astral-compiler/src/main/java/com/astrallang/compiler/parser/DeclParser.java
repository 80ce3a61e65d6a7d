package com.astrallang.compiler.parser;

import com.astrallang.compiler.ast.SourceLocation;
import com.astrallang.compiler.ast.decl.EnumDecl;
import com.astrallang.compiler.ast.decl.FunDecl;
import com.astrallang.compiler.ast.decl.Parameter;
import com.astrallang.compiler.ast.decl.StructDecl;
import com.astrallang.compiler.ast.stmt.Block;

import java.util.ArrayList;
import java.util.List;

import static com.astrallang.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    // fn name(params) [-> type] { ... }
    FunDecl parseFunDecl() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FN, "Expected 'fn'");
        String name = parser.expectIdentifier("Expected function name");

        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = new ArrayList<Parameter>();
        if (!parser.check(RPAREN)) {
            do {
                params.add(parseParameter());
            } while (parser.match(COMMA) && !parser.check(RPAREN));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");

        String returnType = null;
        if (parser.match(ARROW)) {
            returnType = parser.typeParser.parseType();
        }

        Block body = parser.stmtParser.parseBlock();
        return new FunDecl(loc, name, params, returnType, body);
    }

    // [&] [mut] name : type，也接受 name: &T / name: &mut T
    Parameter parseParameter() {
        SourceLocation loc = parser.location();
        boolean reference = parser.match(AMPERSAND);
        boolean mutable = parser.match(KW_MUT);
        String name = parser.expectIdentifier("Expected parameter name");
        parser.expect(COLON, "Expected ':' after parameter name");
        String type = parser.typeParser.parseType();

        if (type.startsWith("&mut ")) {
            reference = true;
            mutable = true;
            type = type.substring("&mut ".length());
        } else if (type.startsWith("&")) {
            reference = true;
            type = type.substring(1);
        }
        return new Parameter(loc, name, type, reference, mutable);
    }

    // struct Name { field: type; ... }
    StructDecl parseStructDecl() {
        SourceLocation loc = parser.location();
        parser.expect(KW_STRUCT, "Expected 'struct'");
        String name = parser.expectIdentifier("Expected struct name");
        parser.expect(LBRACE, "Expected '{' after struct name");

        List<StructDecl.Field> fields = new ArrayList<StructDecl.Field>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation fieldLoc = parser.location();
            String fieldName = parser.expectIdentifier("Expected field name");
            parser.expect(COLON, "Expected ':' after field name");
            String fieldType = parser.typeParser.parseType();
            fields.add(new StructDecl.Field(fieldLoc, fieldName, fieldType));
            if (!parser.match(SEMICOLON)) {
                parser.match(COMMA);
            }
        }
        parser.expect(RBRACE, "Expected '}' after struct fields");
        return new StructDecl(loc, name, fields);
    }

    // enum Name { Variant, Variant(type), ... }
    EnumDecl parseEnumDecl() {
        SourceLocation loc = parser.location();
        parser.expect(KW_ENUM, "Expected 'enum'");
        String name = parser.expectIdentifier("Expected enum name");
        parser.expect(LBRACE, "Expected '{' after enum name");

        List<EnumDecl.Variant> variants = new ArrayList<EnumDecl.Variant>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation variantLoc = parser.location();
            String variantName = parser.expectIdentifier("Expected variant name");
            String payloadType = null;
            if (parser.match(LPAREN)) {
                payloadType = parser.typeParser.parseType();
                parser.expect(RPAREN, "Expected ')' after variant payload type");
            }
            variants.add(new EnumDecl.Variant(variantLoc, variantName, payloadType));
            parser.match(COMMA);
        }
        parser.expect(RBRACE, "Expected '}' after enum variants");
        return new EnumDecl(loc, name, variants);
    }
}

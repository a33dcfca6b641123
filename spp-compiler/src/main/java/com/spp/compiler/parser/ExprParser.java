package com.spp.compiler.parser;

import com.spp.compiler.ast.SourceLocation;
import com.spp.compiler.ast.decl.Arg;
import com.spp.compiler.ast.decl.Arguments;
import com.spp.compiler.ast.expr.*;
import com.spp.compiler.lexer.Token;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.spp.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类，按 Python 优先级从低到高排列
 */
class ExprParser {

    final Parser parser;
    private int depth;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    // 进入一层递归结构；调用方在 finally 中 leaveNested()
    private void enterNested() {
        if (++depth > parser.maxDepth) {
            throw new ParseException("Expression nested too deeply", parser.current);
        }
    }

    private void leaveNested() {
        depth--;
    }

    // ============ 序列与命名表达式 ============

    // star_expressions: 不加括号的元组
    Expression parseStarExpressions() {
        SourceLocation loc = parser.location();
        Expression first = parseStarNamedExpr();
        if (!parser.check(COMMA)) {
            return first;
        }
        return new TupleExpr(loc, parseSequenceRest(first));
    }

    // 在已解析第一个元素后，解析 ", elem" 直到结束符或允许的尾逗号
    private List<Expression> parseSequenceRest(Expression first) {
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (atSequenceEnd()) break;
            elements.add(parseStarNamedExpr());
        }
        return elements;
    }

    private boolean atSequenceEnd() {
        return parser.checkAny(EOF, RPAREN, RBRACKET, RBRACE);
    }

    Expression parseStarNamedExpr() {
        if (parser.match(STAR)) {
            SourceLocation loc = parser.previousLocation();
            return new StarredExpr(loc, parseBitwiseOr());
        }
        return parseNamedExpr();
    }

    // 海象运算符：目标只能是名字
    Expression parseNamedExpr() {
        if (parser.check(IDENTIFIER) && parser.peek().is(WALRUS)) {
            Token name = parser.advance();
            parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression value = parseExpression();
            return new NamedExpr(loc, new NameExpr(name.toLocation(parser.fileName), name.getLexeme()), value);
        }
        return parseExpression();
    }

    Expression parseYieldExpr() {
        parser.expect(KW_YIELD, "Expected 'yield'");
        SourceLocation loc = parser.previousLocation();
        if (parser.match(KW_FROM)) {
            return new YieldFromExpr(loc, parseExpression());
        }
        if (atSequenceEnd()) {
            return new YieldExpr(loc, null);
        }
        return new YieldExpr(loc, parseStarExpressions());
    }

    // ============ 条件与 lambda ============

    Expression parseExpression() {
        if (parser.check(KW_LAMBDA)) {
            return parseLambda();
        }
        Expression thenExpr = parseDisjunction();
        if (parser.match(KW_IF)) {
            SourceLocation loc = parser.previousLocation();
            Expression condition = parseDisjunction();
            parser.expect(KW_ELSE, "Expected 'else' in conditional expression");
            enterNested();
            try {
                return new IfExpr(loc, condition, thenExpr, parseExpression());
            } finally {
                leaveNested();
            }
        }
        return thenExpr;
    }

    private Expression parseLambda() {
        parser.expect(KW_LAMBDA, "Expected 'lambda'");
        SourceLocation loc = parser.previousLocation();
        enterNested();
        try {
            Arguments args = parseLambdaParameters();
            parser.expect(COLON, "Expected ':' after lambda parameters");
            return new LambdaExpr(loc, args, parseExpression());
        } finally {
            leaveNested();
        }
    }

    /**
     * lambda 参数：位置参数（可带默认值）、*args 或单独的 *、仅关键字参数、**kwargs
     *
     * <p>重名参数在这里不检查，由语义校验报告。</p>
     */
    private Arguments parseLambdaParameters() {
        SourceLocation loc = parser.location();
        List<Arg> args = new ArrayList<Arg>();
        List<Arg> kwonly = new ArrayList<Arg>();
        Arg vararg = null;
        Arg kwarg = null;
        boolean afterStar = false;
        boolean seenDefault = false;

        while (!parser.check(COLON)) {
            if (kwarg != null) {
                throw new ParseException("Arguments cannot follow var-keyword argument", parser.current);
            }
            if (parser.match(DOUBLE_STAR)) {
                kwarg = parseLambdaParam(false);
            } else if (parser.match(STAR)) {
                if (afterStar) {
                    throw new ParseException("* argument may appear only once", parser.previous);
                }
                afterStar = true;
                if (parser.check(IDENTIFIER)) {
                    vararg = parseLambdaParam(false);
                } else if (!parser.check(COMMA)) {
                    throw new ParseException("Named arguments must follow bare *", parser.current);
                }
            } else {
                Arg arg = parseLambdaParam(true);
                if (afterStar) {
                    kwonly.add(arg);
                } else {
                    if (arg.hasDefaultValue()) {
                        seenDefault = true;
                    } else if (seenDefault) {
                        throw new ParseException("Non-default argument follows default argument", parser.previous);
                    }
                    args.add(arg);
                }
            }
            if (!parser.match(COMMA)) break;
        }
        return new Arguments(loc, args, vararg, kwonly, kwarg);
    }

    private Arg parseLambdaParam(boolean allowDefault) {
        Token name = parser.expect(IDENTIFIER, "Expected parameter name");
        Expression defaultValue = null;
        if (allowDefault && parser.match(ASSIGN)) {
            defaultValue = parseExpression();
        }
        return new Arg(name.toLocation(parser.fileName), name.getLexeme(), null, defaultValue);
    }

    // ============ 布尔运算 ============

    private Expression parseDisjunction() {
        SourceLocation loc = parser.location();
        Expression first = parseConjunction();
        if (!parser.check(KW_OR)) {
            return first;
        }
        List<Expression> values = new ArrayList<Expression>();
        values.add(first);
        while (parser.match(KW_OR)) {
            values.add(parseConjunction());
        }
        return new BoolOpExpr(loc, BoolOpExpr.BoolOp.OR, values);
    }

    private Expression parseConjunction() {
        SourceLocation loc = parser.location();
        Expression first = parseInversion();
        if (!parser.check(KW_AND)) {
            return first;
        }
        List<Expression> values = new ArrayList<Expression>();
        values.add(first);
        while (parser.match(KW_AND)) {
            values.add(parseInversion());
        }
        return new BoolOpExpr(loc, BoolOpExpr.BoolOp.AND, values);
    }

    private Expression parseInversion() {
        if (parser.match(KW_NOT)) {
            SourceLocation loc = parser.previousLocation();
            enterNested();
            try {
                return new UnaryExpr(loc, UnaryExpr.UnaryOp.NOT, parseInversion());
            } finally {
                leaveNested();
            }
        }
        return parseComparison();
    }

    // ============ 比较（链式比较合并为一个节点） ============

    private Expression parseComparison() {
        SourceLocation loc = parser.location();
        Expression left = parseBitwiseOr();

        List<CompareExpr.CompareOp> operators = new ArrayList<CompareExpr.CompareOp>();
        List<Expression> comparators = new ArrayList<Expression>();
        CompareExpr.CompareOp op;
        while ((op = matchCompareOp()) != null) {
            operators.add(op);
            comparators.add(parseBitwiseOr());
        }
        if (operators.isEmpty()) {
            return left;
        }
        return new CompareExpr(loc, left, operators, comparators);
    }

    private CompareExpr.CompareOp matchCompareOp() {
        switch (parser.current.getType()) {
            case LT: parser.advance(); return CompareExpr.CompareOp.LT;
            case GT: parser.advance(); return CompareExpr.CompareOp.GT;
            case LE: parser.advance(); return CompareExpr.CompareOp.LE;
            case GE: parser.advance(); return CompareExpr.CompareOp.GE;
            case EQ: parser.advance(); return CompareExpr.CompareOp.EQ;
            case NE: parser.advance(); return CompareExpr.CompareOp.NE;
            case KW_IN: parser.advance(); return CompareExpr.CompareOp.IN;
            case KW_IS:
                parser.advance();
                return parser.match(KW_NOT) ? CompareExpr.CompareOp.IS_NOT : CompareExpr.CompareOp.IS;
            case KW_NOT:
                if (parser.peek().is(KW_IN)) {
                    parser.advance();
                    parser.advance();
                    return CompareExpr.CompareOp.NOT_IN;
                }
                return null;
            default:
                return null;
        }
    }

    // ============ 二元运算（左结合） ============

    Expression parseBitwiseOr() {
        Expression left = parseBitwiseXor();
        while (parser.match(PIPE)) {
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.BIT_OR, parseBitwiseXor());
        }
        return left;
    }

    private Expression parseBitwiseXor() {
        Expression left = parseBitwiseAnd();
        while (parser.match(CARET)) {
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.BIT_XOR, parseBitwiseAnd());
        }
        return left;
    }

    private Expression parseBitwiseAnd() {
        Expression left = parseShift();
        while (parser.match(AMPERSAND)) {
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.BIT_AND, parseShift());
        }
        return left;
    }

    private Expression parseShift() {
        Expression left = parseSum();
        while (parser.checkAny(LSHIFT, RSHIFT)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            BinaryExpr.BinaryOp binOp = op.is(LSHIFT) ? BinaryExpr.BinaryOp.LSHIFT : BinaryExpr.BinaryOp.RSHIFT;
            left = new BinaryExpr(loc, left, binOp, parseSum());
        }
        return left;
    }

    private Expression parseSum() {
        Expression left = parseTerm();
        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            BinaryExpr.BinaryOp binOp = op.is(PLUS) ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
            left = new BinaryExpr(loc, left, binOp, parseTerm());
        }
        return left;
    }

    private Expression parseTerm() {
        Expression left = parseFactor();
        while (parser.checkAny(STAR, SLASH, DOUBLE_SLASH, PERCENT, AT)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case STAR: binOp = BinaryExpr.BinaryOp.MUL; break;
                case SLASH: binOp = BinaryExpr.BinaryOp.DIV; break;
                case DOUBLE_SLASH: binOp = BinaryExpr.BinaryOp.FLOOR_DIV; break;
                case PERCENT: binOp = BinaryExpr.BinaryOp.MOD; break;
                case AT: binOp = BinaryExpr.BinaryOp.MAT_MUL; break;
                default: throw new ParseException("Unexpected operator", op);
            }
            left = new BinaryExpr(loc, left, binOp, parseFactor());
        }
        return left;
    }

    // 一元 + - ~；括号、列表、下标、调用等嵌套都经过这一层，在此计数
    private Expression parseFactor() {
        enterNested();
        try {
            if (parser.checkAny(PLUS, MINUS, TILDE)) {
                Token op = parser.advance();
                SourceLocation loc = parser.previousLocation();
                UnaryExpr.UnaryOp unaryOp;
                switch (op.getType()) {
                    case PLUS: unaryOp = UnaryExpr.UnaryOp.POS; break;
                    case MINUS: unaryOp = UnaryExpr.UnaryOp.NEG; break;
                    default: unaryOp = UnaryExpr.UnaryOp.INVERT; break;
                }
                return new UnaryExpr(loc, unaryOp, parseFactor());
            }
            return parsePower();
        } finally {
            leaveNested();
        }
    }

    // ** 右结合，右侧可以是一元表达式：-2 ** -1 == -(2 ** (-1))
    private Expression parsePower() {
        Expression base = parseAwaitPrimary();
        if (parser.match(DOUBLE_STAR)) {
            SourceLocation loc = parser.previousLocation();
            return new BinaryExpr(loc, base, BinaryExpr.BinaryOp.POW, parseFactor());
        }
        return base;
    }

    private Expression parseAwaitPrimary() {
        if (parser.match(KW_AWAIT)) {
            SourceLocation loc = parser.previousLocation();
            return new AwaitExpr(loc, parsePrimary());
        }
        return parsePrimary();
    }

    // ============ 后缀：属性、调用、下标 ============

    private Expression parsePrimary() {
        Expression expr = parseAtom();
        while (true) {
            if (parser.match(DOT)) {
                SourceLocation loc = parser.previousLocation();
                Token name = parser.expect(IDENTIFIER, "Expected attribute name after '.'");
                expr = new AttributeExpr(loc, expr, name.getLexeme());
            } else if (parser.match(LPAREN)) {
                SourceLocation loc = parser.previousLocation();
                expr = new CallExpr(loc, expr, parseCallArguments());
            } else if (parser.match(LBRACKET)) {
                SourceLocation loc = parser.previousLocation();
                Slice slice = parseSlices();
                parser.expect(RBRACKET, "Expected ']' after subscript");
                expr = new SubscriptExpr(loc, expr, slice);
            } else {
                return expr;
            }
        }
    }

    /**
     * 调用参数，左括号已消费
     *
     * <p>关键字参数的名字按表达式解析，{@code f(a.b=1)} 能通过语法分析，由语义校验拒绝。</p>
     */
    private List<CallArgument> parseCallArguments() {
        List<CallArgument> args = new ArrayList<CallArgument>();
        while (!parser.check(RPAREN)) {
            SourceLocation loc = parser.location();
            if (parser.match(DOUBLE_STAR)) {
                args.add(new KeywordArg(loc, null, parseExpression()));
            } else if (parser.match(STAR)) {
                args.add(new PositionalArg(loc, new StarredExpr(loc, parseExpression())));
            } else {
                Expression value = parseNamedExpr();
                if (parser.match(ASSIGN)) {
                    args.add(new KeywordArg(loc, value, parseExpression()));
                } else if (parser.checkAny(KW_FOR, KW_ASYNC)) {
                    // 唯一参数为生成器表达式：f(x for x in y)
                    if (!args.isEmpty()) {
                        throw new ParseException("Generator expression must be parenthesized", parser.current);
                    }
                    args.add(new PositionalArg(loc, new GeneratorExpr(loc, value, parseComprehensions())));
                    if (!parser.check(RPAREN)) {
                        throw new ParseException("Generator expression must be parenthesized", parser.current);
                    }
                } else {
                    args.add(new PositionalArg(loc, value));
                }
            }
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    /**
     * 下标：单个索引、切片，或逗号分隔的多维下标
     *
     * <p>全部是索引时合并为以元组为值的索引；含有切片时得到扩展切片。</p>
     */
    private Slice parseSlices() {
        SourceLocation loc = parser.location();
        Slice first = parseSlice();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Slice> dims = new ArrayList<Slice>();
        dims.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;
            dims.add(parseSlice());
        }

        List<Expression> indexes = new ArrayList<Expression>();
        for (Slice dim : dims) {
            if (!(dim instanceof IndexSlice)) {
                return new ExtSlice(loc, dims);
            }
            indexes.add(((IndexSlice) dim).getValue());
        }
        return new IndexSlice(loc, new TupleExpr(loc, indexes));
    }

    private Slice parseSlice() {
        SourceLocation loc = parser.location();
        Expression lower = null;
        if (!parser.check(COLON)) {
            lower = parseStarNamedExpr();
            if (!parser.check(COLON)) {
                return new IndexSlice(loc, lower);
            }
        }
        parser.expect(COLON, "Expected ':' in slice");
        Expression upper = null;
        if (!parser.checkAny(COLON, COMMA, RBRACKET)) {
            upper = parseExpression();
        }
        Expression step = null;
        if (parser.match(COLON) && !parser.checkAny(COMMA, RBRACKET)) {
            step = parseExpression();
        }
        return new DefaultSlice(loc, lower, upper, step);
    }

    // ============ 推导式 ============

    private List<Comprehension> parseComprehensions() {
        List<Comprehension> generators = new ArrayList<Comprehension>();
        while (parser.check(KW_FOR) || (parser.check(KW_ASYNC) && parser.peek().is(KW_FOR))) {
            SourceLocation loc = parser.location();
            boolean async = parser.match(KW_ASYNC);
            parser.expect(KW_FOR, "Expected 'for'");
            Expression target = parseTargetList();
            parser.expect(KW_IN, "Expected 'in' in comprehension");
            Expression iter = parseDisjunction();
            List<Expression> ifs = new ArrayList<Expression>();
            while (parser.match(KW_IF)) {
                ifs.add(parseDisjunction());
            }
            generators.add(new Comprehension(loc, target, iter, ifs, async));
        }
        return generators;
    }

    // 推导式目标：在 bitwise-or 层级解析，避免吞掉 'in'；是否可赋值由语义校验判断
    private Expression parseTargetList() {
        SourceLocation loc = parser.location();
        Expression first = parseTarget();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(KW_IN)) break;
            elements.add(parseTarget());
        }
        return new TupleExpr(loc, elements);
    }

    private Expression parseTarget() {
        if (parser.match(STAR)) {
            SourceLocation loc = parser.previousLocation();
            return new StarredExpr(loc, parseBitwiseOr());
        }
        return parseBitwiseOr();
    }

    // ============ 原子 ============

    private Expression parseAtom() {
        Token token = parser.current;
        SourceLocation loc = parser.location();
        switch (token.getType()) {
            case IDENTIFIER:
                parser.advance();
                return new NameExpr(loc, token.getLexeme());
            case KW_TRUE:
                parser.advance();
                return new Constant(loc, Boolean.TRUE, Constant.ConstantKind.BOOLEAN);
            case KW_FALSE:
                parser.advance();
                return new Constant(loc, Boolean.FALSE, Constant.ConstantKind.BOOLEAN);
            case KW_NONE:
                parser.advance();
                return Constant.none(loc);
            case ELLIPSIS:
                parser.advance();
                return new Constant(loc, null, Constant.ConstantKind.ELLIPSIS);
            case INT_LITERAL:
                parser.advance();
                return Constant.ofInt(loc, (BigInteger) token.getLiteral());
            case FLOAT_LITERAL:
                parser.advance();
                return new Constant(loc, token.getLiteral(), Constant.ConstantKind.FLOAT);
            case IMAGINARY_LITERAL:
                parser.advance();
                return new Constant(loc, token.getLiteral(), Constant.ConstantKind.COMPLEX);
            case STRING_LITERAL:
                return parseStrings();
            case LPAREN:
                return parseParenthesized();
            case LBRACKET:
                return parseListDisplay();
            case LBRACE:
                return parseBraceDisplay();
            default:
                throw new ParseException("Expected expression", token);
        }
    }

    /**
     * 相邻字符串拼接
     *
     * <p>全部是普通字面量时合并为一个常量；含格式化字面量时合并为一个 JoinedStr，
     * 相邻的常量片段合并为一个。字节串不能与普通字符串混用。</p>
     */
    private Expression parseStrings() {
        SourceLocation loc = parser.location();
        List<Expression> parts = new ArrayList<Expression>();
        int bytesCount = 0;
        boolean formatted = false;
        while (parser.check(STRING_LITERAL)) {
            Token token = parser.advance();
            StringLiteral literal = token.getStringLiteral();
            if (literal.isBytes()) bytesCount++;
            if (literal.isFormatted()) formatted = true;
            parts.add(parser.literalParser.parse(literal));
        }
        if (bytesCount != 0 && bytesCount != parts.size()) {
            throw new ParseException("Cannot mix bytes and nonbytes literals", parser.previous);
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }

        if (!formatted) {
            StringBuilder sb = new StringBuilder();
            for (Expression part : parts) {
                sb.append(((Constant) part).getStringValue());
            }
            Constant.ConstantKind kind = bytesCount > 0 ? Constant.ConstantKind.BYTES : Constant.ConstantKind.STRING;
            return new Constant(loc, sb.toString(), kind);
        }

        List<Expression> values = new ArrayList<Expression>();
        StringBuilder pending = new StringBuilder();
        for (Expression part : parts) {
            List<Expression> fragments = part instanceof JoinedStr
                    ? ((JoinedStr) part).getValues()
                    : Collections.<Expression>singletonList(part);
            for (Expression fragment : fragments) {
                if (fragment instanceof Constant) {
                    pending.append(((Constant) fragment).getStringValue());
                } else {
                    if (pending.length() > 0) {
                        values.add(Constant.ofString(loc, pending.toString()));
                        pending.setLength(0);
                    }
                    values.add(fragment);
                }
            }
        }
        if (pending.length() > 0) {
            values.add(Constant.ofString(loc, pending.toString()));
        }
        return new JoinedStr(loc, values);
    }

    // ( ) 空元组、括号表达式、元组、生成器表达式、yield
    private Expression parseParenthesized() {
        parser.expect(LPAREN, "Expected '('");
        SourceLocation loc = parser.previousLocation();
        if (parser.match(RPAREN)) {
            return new TupleExpr(loc, new ArrayList<Expression>());
        }
        if (parser.check(KW_YIELD)) {
            Expression yield = parseYieldExpr();
            parser.expect(RPAREN, "Expected ')' after yield expression");
            return yield;
        }

        Expression first = parseStarNamedExpr();
        Expression result;
        if (parser.checkAny(KW_FOR, KW_ASYNC)) {
            result = new GeneratorExpr(loc, first, parseComprehensions());
        } else if (parser.check(COMMA)) {
            result = new TupleExpr(loc, parseSequenceRest(first));
        } else {
            result = first;
        }
        parser.expect(RPAREN, "Expected ')'");
        return result;
    }

    // [ ] 列表与列表推导式
    private Expression parseListDisplay() {
        parser.expect(LBRACKET, "Expected '['");
        SourceLocation loc = parser.previousLocation();
        if (parser.match(RBRACKET)) {
            return new ListExpr(loc, new ArrayList<Expression>());
        }

        Expression first = parseStarNamedExpr();
        Expression result;
        if (parser.checkAny(KW_FOR, KW_ASYNC)) {
            result = new ListCompExpr(loc, first, parseComprehensions());
        } else {
            result = new ListExpr(loc, parseSequenceRest(first));
        }
        parser.expect(RBRACKET, "Expected ']'");
        return result;
    }

    // { } 字典、集合及其推导式；{} 为空字典
    private Expression parseBraceDisplay() {
        parser.expect(LBRACE, "Expected '{'");
        SourceLocation loc = parser.previousLocation();
        if (parser.match(RBRACE)) {
            return new DictExpr(loc, new ArrayList<KeyValue>());
        }

        Expression result;
        if (parser.check(DOUBLE_STAR)) {
            result = new DictExpr(loc, parseDictEntries(null));
        } else {
            SourceLocation entryLoc = parser.location();
            Expression first = parseStarNamedExpr();
            if (parser.match(COLON)) {
                KeyValue entry = new KeyValue(entryLoc, first, parseExpression());
                if (parser.checkAny(KW_FOR, KW_ASYNC)) {
                    result = new DictCompExpr(loc, entry, parseComprehensions());
                } else {
                    result = new DictExpr(loc, parseDictEntries(entry));
                }
            } else if (parser.checkAny(KW_FOR, KW_ASYNC)) {
                result = new SetCompExpr(loc, first, parseComprehensions());
            } else {
                result = new SetExpr(loc, parseSequenceRest(first));
            }
        }
        parser.expect(RBRACE, "Expected '}'");
        return result;
    }

    // 字典项："key: value" 或 "**mapping"，first 为已解析的第一项
    private List<KeyValue> parseDictEntries(KeyValue first) {
        List<KeyValue> entries = new ArrayList<KeyValue>();
        if (first != null) {
            entries.add(first);
            if (!parser.match(COMMA)) return entries;
        }
        while (!parser.check(RBRACE)) {
            SourceLocation loc = parser.location();
            if (parser.match(DOUBLE_STAR)) {
                entries.add(new KeyValue(loc, null, parseBitwiseOr()));
            } else {
                Expression key = parseExpression();
                parser.expect(COLON, "Expected ':' in dictionary entry");
                entries.add(new KeyValue(loc, key, parseExpression()));
            }
            if (!parser.match(COMMA)) break;
        }
        return entries;
    }
}

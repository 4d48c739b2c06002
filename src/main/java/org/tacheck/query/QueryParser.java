package org.tacheck.query;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.tacheck.automata.symbolic.StatePredicate;
import org.tacheck.core.Clock;
import org.tacheck.exceptions.QueryParseException;
import org.tacheck.expressions.RelationType;
import org.tacheck.expressions.dcs.ClockConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 查询文本的递归下降解析器。
 * <pre>
 * queries      := query (';' query)*
 * query        := kind ':' body
 * refinement   := system '<=' system
 * consistency  := system
 * determinism  := system
 * reachability := system ('@' predicate)? '->' predicate | IDENT '.' IDENT
 * get-components, prune := system 'save-as' IDENT
 * system       := composition ('\\' composition)*
 * composition  := conjunction (('//' | '||') conjunction)*
 * conjunction  := primary ('&&' primary)*
 * primary      := IDENT | '(' system ')'
 * predicate    := conj ('||' conj)*
 * conj         := atom ('&&' atom)*
 * atom         := '(' predicate ')' | 'true' | IDENT '.' IDENT
 *               | IDENT '.' IDENT ('-' IDENT '.' IDENT)? relop '-'? INT
 * </pre>
 * 出错时抛出 {@link QueryParseException}，位置是相对整段输入文本的字符偏移。
 */
public final class QueryParser {

    private static final Logger logger = LoggerFactory.getLogger(QueryParser.class);

    // 长的符号在前，保证最长匹配
    private static final List<String> SYMBOLS = List.of(
            "\\\\", "&&", "||", "//", "<=", ">=", "==", "->",
            "\\", "<", ">", "=", ":", "(", ")", "@", ".", "-");

    private static final Set<String> RELATIONS = Set.of("<", "<=", ">", ">=", "==", "=");

    /**
     * 分号分隔后的一段查询文本及其在整段输入中的起始偏移。
     */
    @Getter
    public static final class Segment {
        private final String text;
        private final int offset;

        private Segment(String text, int offset) {
            this.text = text;
            this.offset = offset;
        }

        @Override
        public String toString() {
            return text.trim();
        }
    }

    private enum TokenType {
        IDENT,
        INT,
        SYMBOL,
        EOF
    }

    private static final class Token {
        private final TokenType type;
        private final String text;
        private final int position;

        private Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }

        private boolean is(String symbol) {
            return type == TokenType.SYMBOL && text.equals(symbol);
        }

        private boolean isWord(String word) {
            return type == TokenType.IDENT && text.equals(word);
        }

        private String describe() {
            return type == TokenType.EOF ? "输入结束" : "'" + text + "'";
        }
    }

    private final String source;
    private final List<Token> tokens;
    private int cursor;

    private QueryParser(Segment segment) {
        this.source = segment.text.trim();
        this.tokens = tokenize(segment.text, segment.offset);
        this.cursor = 0;
    }

    /**
     * 按分号切分查询列表，跳过空白段。
     */
    public static List<Segment> split(String text) {
        List<Segment> segments = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= text.length(); i++) {
            if (i == text.length() || text.charAt(i) == ';') {
                String part = text.substring(start, i);
                if (!StringUtils.isBlank(part)) {
                    segments.add(new Segment(part, start));
                }
                start = i + 1;
            }
        }
        return segments;
    }

    /**
     * 解析单个查询。
     * @throws QueryParseException 文本不符合语法
     */
    public static Query parse(String text) {
        return parse(new Segment(text, 0));
    }

    public static Query parse(Segment segment) {
        QueryParser parser = new QueryParser(segment);
        Query query = parser.parseQuery();
        logger.debug("解析查询 '{}' -> {}", parser.source, query.getKind());
        return query;
    }

    /**
     * 解析分号分隔的查询列表，遇到第一个错误即抛出。
     */
    public static List<Query> parseAll(String text) {
        List<Query> queries = new ArrayList<>();
        for (Segment segment : split(text)) {
            queries.add(parse(segment));
        }
        return queries;
    }

    // --- 词法 ---

    private static List<Token> tokenize(String text, int offset) {
        List<Token> result = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                result.add(new Token(TokenType.IDENT, text.substring(start, i), offset + start));
                continue;
            }
            if (Character.isDigit(c)) {
                int start = i;
                while (i < text.length() && Character.isDigit(text.charAt(i))) {
                    i++;
                }
                result.add(new Token(TokenType.INT, text.substring(start, i), offset + start));
                continue;
            }
            String symbol = null;
            for (String candidate : SYMBOLS) {
                if (text.startsWith(candidate, i)) {
                    symbol = candidate;
                    break;
                }
            }
            if (symbol == null) {
                throw new QueryParseException("无法识别的字符 '" + c + "'", offset + i);
            }
            result.add(new Token(TokenType.SYMBOL, symbol, offset + i));
            i += symbol.length();
        }
        result.add(new Token(TokenType.EOF, "", offset + text.length()));
        return result;
    }

    // --- 语法 ---

    private Token peek() {
        return tokens.get(cursor);
    }

    private Token peekAhead(int distance) {
        return tokens.get(Math.min(cursor + distance, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(cursor);
        if (token.type != TokenType.EOF) {
            cursor++;
        }
        return token;
    }

    private Token expect(String symbol) {
        Token token = peek();
        if (!token.is(symbol)) {
            throw error("期望 '" + symbol + "' 但遇到 " + token.describe(), token);
        }
        return advance();
    }

    private String expectIdentifier(String what) {
        Token token = peek();
        if (token.type != TokenType.IDENT) {
            throw error("期望" + what + "但遇到 " + token.describe(), token);
        }
        return advance().text;
    }

    private static QueryParseException error(String message, Token token) {
        return new QueryParseException(message, token.position);
    }

    private Query parseQuery() {
        QueryKind kind = parseKind();
        expect(":");
        Query query = switch (kind) {
            case REFINEMENT -> {
                SystemExpression left = parseSystem();
                expect("<=");
                yield Query.refinement(left, parseSystem(), source);
            }
            case CONSISTENCY -> Query.consistency(parseSystem(), source);
            case DETERMINISM -> Query.determinism(parseSystem(), source);
            case REACHABILITY -> parseReachability();
            case GET_COMPONENTS -> {
                SystemExpression system = parseSystem();
                yield Query.getComponents(system, parseSaveAs(), source);
            }
            case PRUNE -> {
                SystemExpression system = parseSystem();
                yield Query.prune(system, parseSaveAs(), source);
            }
        };
        Token rest = peek();
        if (rest.type != TokenType.EOF) {
            throw error("查询末尾有多余的内容 " + rest.describe(), rest);
        }
        return query;
    }

    private QueryKind parseKind() {
        Token first = peek();
        String keyword = expectIdentifier("查询种类");
        while (peek().is("-") && peekAhead(1).type == TokenType.IDENT) {
            advance();
            keyword = keyword + "-" + advance().text;
        }
        if ("get-component".equals(keyword)) {
            return QueryKind.GET_COMPONENTS;
        }
        return QueryKind.fromKeyword(keyword)
                .orElseThrow(() -> error("未知的查询种类 '" + first.text + "'", first));
    }

    private String parseSaveAs() {
        Token token = peek();
        if (!token.isWord("save") || !peekAhead(1).is("-") || !peekAhead(2).isWord("as")) {
            throw error("期望 'save-as' 但遇到 " + token.describe(), token);
        }
        advance();
        advance();
        advance();
        return expectIdentifier("组件名");
    }

    private Query parseReachability() {
        // 简写: reachability: C.L
        if (peek().type == TokenType.IDENT && peekAhead(1).is(".") && peekAhead(2).type == TokenType.IDENT
                && peekAhead(3).type == TokenType.EOF) {
            String component = advance().text;
            advance();
            String location = advance().text;
            return Query.reachability(SystemExpression.component(component), null,
                    StatePredicate.location(component, location), source);
        }
        SystemExpression system = parseSystem();
        StatePredicate start = null;
        if (peek().is("@")) {
            advance();
            start = parsePredicate();
        }
        expect("->");
        StatePredicate target = parsePredicate();
        return Query.reachability(system, start, target, source);
    }

    private SystemExpression parseSystem() {
        SystemExpression left = parseComposition();
        while (peek().is("\\\\") || peek().is("\\")) {
            advance();
            left = SystemExpression.quotient(left, parseComposition());
        }
        return left;
    }

    private SystemExpression parseComposition() {
        SystemExpression left = parseConjunction();
        while (peek().is("//") || peek().is("||")) {
            advance();
            left = SystemExpression.composition(left, parseConjunction());
        }
        return left;
    }

    private SystemExpression parseConjunction() {
        SystemExpression left = parsePrimary();
        while (peek().is("&&")) {
            advance();
            left = SystemExpression.conjunction(left, parsePrimary());
        }
        return left;
    }

    private SystemExpression parsePrimary() {
        Token token = peek();
        if (token.is("(")) {
            advance();
            SystemExpression inner = parseSystem();
            expect(")");
            return inner;
        }
        if (token.type == TokenType.IDENT) {
            return SystemExpression.component(advance().text);
        }
        throw error("期望组件名或 '(' 但遇到 " + token.describe(), token);
    }

    private StatePredicate parsePredicate() {
        StatePredicate left = parsePredicateConjunction();
        while (peek().is("||")) {
            advance();
            left = StatePredicate.or(left, parsePredicateConjunction());
        }
        return left;
    }

    private StatePredicate parsePredicateConjunction() {
        StatePredicate left = parseAtom();
        while (peek().is("&&")) {
            advance();
            left = StatePredicate.and(left, parseAtom());
        }
        return left;
    }

    private StatePredicate parseAtom() {
        Token token = peek();
        if (token.is("(")) {
            advance();
            StatePredicate inner = parsePredicate();
            expect(")");
            return inner;
        }
        if (token.isWord("true") && !peekAhead(1).is(".")) {
            advance();
            return StatePredicate.always();
        }
        String component = expectIdentifier("组件名");
        expect(".");
        String name = expectIdentifier("位置名或时钟名");
        Token next = peek();
        if (!next.is("-") && !isRelation(next)) {
            return StatePredicate.location(component, name);
        }
        Clock first = Clock.of(component, name);
        Clock second = Clock.ZERO_CLOCK;
        if (next.is("-")) {
            advance();
            String otherComponent = expectIdentifier("组件名");
            expect(".");
            second = Clock.of(otherComponent, expectIdentifier("时钟名"));
        }
        Token relationToken = peek();
        if (!isRelation(relationToken)) {
            throw error("期望比较运算符但遇到 " + relationToken.describe(), relationToken);
        }
        advance();
        RelationType relation = RelationType.fromSymbol(relationToken.text);
        int bound = parseSignedInt();
        try {
            return StatePredicate.clock(ClockConstraint.of(first, second, relation, bound));
        } catch (IllegalArgumentException e) {
            throw new QueryParseException("非法的时钟约束: " + e.getMessage(), token.position);
        }
    }

    private static boolean isRelation(Token token) {
        return token.type == TokenType.SYMBOL && RELATIONS.contains(token.text);
    }

    private int parseSignedInt() {
        boolean negative = false;
        if (peek().is("-")) {
            advance();
            negative = true;
        }
        Token token = peek();
        if (token.type != TokenType.INT) {
            throw error("期望整数但遇到 " + token.describe(), token);
        }
        advance();
        try {
            int value = Integer.parseInt(token.text);
            return negative ? -value : value;
        } catch (NumberFormatException e) {
            throw new QueryParseException("整数超出范围: " + token.text, token.position);
        }
    }
}

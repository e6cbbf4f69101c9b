package com.dealengine.condition;

import com.dealengine.common.exception.ConditionParseException;
import com.dealengine.game.GameFact;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles authored trigger conditions into predicate trees.
 *
 * Accepted forms, combined with "and", "+" or "&" (and, with lower precedence, "or"):
 * - win clauses: "win", "home win", "away win", "any win", "win at home", "win on the road"
 * - winning margins: "win by 5 runs", "home win by 3+"
 * - loss clauses: "loss", "home loss", "lost on the road"
 * - thresholds: "7+ strikeouts", "runs scored >= 6", "hits > 10"
 * - bare stats, meaning at least one: "stolen base at home"
 * - locations ("home game", "away") only when joined by "and" to one of the above
 *
 * Every word must resolve through {@link StatVocabulary}; anything else fails with
 * a {@link ConditionParseException} naming the offending token. The parser is
 * stateless and safe for concurrent use.
 */
@Component
public class ConditionParser {

    static final int MAX_SOURCE_LENGTH = 200;

    private static final String MARGIN_WORD = "by";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN = Pattern.compile(
        "(?<threshold>\\d+\\+)|(?<number>\\d+)|(?<operator>>=|<=|==|=|>|<)|(?<and>\\+|&)|(?<word>[a-z]+)|(?<other>\\S)");

    private enum TokenType {
        THRESHOLD,
        NUMBER,
        OPERATOR,
        AND,
        OR,
        WORD
    }

    private static final class Clause {
        final Predicate predicate;
        final boolean locationOnly;

        Clause(Predicate predicate, boolean locationOnly) {
            this.predicate = predicate;
            this.locationOnly = locationOnly;
        }
    }

    private static final class Token {
        final TokenType type;
        final String text;

        Token(TokenType type, String text) {
            this.type = type;
            this.text = text;
        }
    }

    /**
     * Lower-case, trim and collapse whitespace. Two sources with the same
     * normalized form always compile to the same predicate.
     */
    public static String normalize(String source) {
        if (source == null) {
            return "";
        }
        return WHITESPACE.matcher(source.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * Parse a condition.
     *
     * @param source the authored condition text
     * @return the compiled predicate; {@link Literal#FALSE} for a blank source
     * @throws ConditionParseException if any token cannot be understood
     */
    public Predicate parse(String source) {
        String normalized = normalize(source);
        if (normalized.isEmpty()) {
            return Literal.FALSE;
        }
        if (normalized.length() > MAX_SOURCE_LENGTH) {
            throw new ConditionParseException(source, normalized.substring(MAX_SOURCE_LENGTH),
                "condition exceeds " + MAX_SOURCE_LENGTH + " characters");
        }

        List<Token> tokens = tokenize(source, normalized);
        List<Predicate> alternatives = new ArrayList<>();
        for (List<Token> group : split(source, tokens, TokenType.OR)) {
            List<Predicate> clauses = new ArrayList<>();
            boolean anchored = false;
            for (List<Token> clauseTokens : split(source, group, TokenType.AND)) {
                Clause clause = parseClause(source, clauseTokens);
                anchored |= !clause.locationOnly;
                addFlattened(clauses, clause.predicate);
            }
            if (!anchored) {
                throw new ConditionParseException(source, group.get(0).text,
                    "location needs a win, a loss or a stat joined to it");
            }
            alternatives.add(clauses.size() == 1 ? clauses.get(0) : new Conjunction(clauses));
        }
        return alternatives.size() == 1 ? alternatives.get(0) : new Disjunction(alternatives);
    }

    private List<Token> tokenize(String source, String normalized) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(normalized);
        while (matcher.find()) {
            if (matcher.group("threshold") != null) {
                String text = matcher.group();
                if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type == TokenType.OPERATOR) {
                    // "runs>=6+home win": after a comparator the '+' is a connective
                    tokens.add(new Token(TokenType.NUMBER, text.substring(0, text.length() - 1)));
                    tokens.add(new Token(TokenType.AND, "+"));
                } else {
                    tokens.add(new Token(TokenType.THRESHOLD, text));
                }
            } else if (matcher.group("number") != null) {
                tokens.add(new Token(TokenType.NUMBER, matcher.group()));
            } else if (matcher.group("operator") != null) {
                tokens.add(new Token(TokenType.OPERATOR, matcher.group()));
            } else if (matcher.group("and") != null) {
                tokens.add(new Token(TokenType.AND, matcher.group()));
            } else if (matcher.group("word") != null) {
                String word = matcher.group();
                if ("and".equals(word)) {
                    tokens.add(new Token(TokenType.AND, word));
                } else if ("or".equals(word)) {
                    tokens.add(new Token(TokenType.OR, word));
                } else {
                    tokens.add(new Token(TokenType.WORD, word));
                }
            } else {
                throw new ConditionParseException(source, matcher.group(), "unexpected character");
            }
        }
        return tokens;
    }

    private List<List<Token>> split(String source, List<Token> tokens, TokenType separator) {
        List<List<Token>> parts = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        Token lastSeparator = null;
        for (Token token : tokens) {
            if (token.type == separator) {
                if (current.isEmpty()) {
                    throw new ConditionParseException(source, token.text, "connective without a clause before it");
                }
                parts.add(current);
                current = new ArrayList<>();
                lastSeparator = token;
            } else {
                current.add(token);
            }
        }
        if (current.isEmpty()) {
            String offending = lastSeparator != null ? lastSeparator.text : source;
            throw new ConditionParseException(source, offending, "connective without a clause after it");
        }
        parts.add(current);
        return parts;
    }

    private Clause parseClause(String source, List<Token> tokens) {
        boolean win = false;
        boolean loss = false;
        boolean home = false;
        boolean away = false;
        String stat = null;
        ComparisonOperator operator = null;
        Integer threshold = null;
        Token thresholdToken = null;
        Integer margin = null;

        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            switch (token.type) {
                case THRESHOLD:
                    if (threshold != null) {
                        throw new ConditionParseException(source, token.text, "clause has more than one threshold");
                    }
                    operator = ComparisonOperator.GTE;
                    threshold = parseNumber(source, stripPlus(token.text));
                    thresholdToken = token;
                    i++;
                    break;
                case OPERATOR:
                    if (threshold != null) {
                        throw new ConditionParseException(source, token.text, "clause has more than one threshold");
                    }
                    if (i + 1 >= tokens.size() || tokens.get(i + 1).type != TokenType.NUMBER) {
                        throw new ConditionParseException(source, token.text, "comparator must be followed by a number");
                    }
                    operator = ComparisonOperator.fromSymbol(token.text)
                        .orElseThrow(() -> new ConditionParseException(source, token.text, "unknown comparator"));
                    threshold = parseNumber(source, tokens.get(i + 1).text);
                    thresholdToken = token;
                    i += 2;
                    break;
                case NUMBER:
                    throw new ConditionParseException(source, token.text,
                        "number needs a comparator, e.g. '" + token.text + "+' or '>= " + token.text + "'");
                case WORD:
                    if (MARGIN_WORD.equals(token.text)) {
                        if (!win) {
                            throw new ConditionParseException(source, token.text, "'by' must follow a win");
                        }
                        if (margin != null) {
                            throw new ConditionParseException(source, token.text, "clause has more than one margin");
                        }
                        margin = parseMargin(source, tokens, i);
                        i += 2;
                        if (i < tokens.size() && tokens.get(i).type == TokenType.WORD
                                && StatVocabulary.MARGIN_UNITS.contains(tokens.get(i).text)) {
                            i++;
                        }
                        break;
                    }
                    int end = wordRunEnd(tokens, i);
                    int consumed = matchPhrase(source, tokens, i, end);
                    String phrase = joinWords(tokens, i, i + consumed);
                    StatVocabulary.Term term = StatVocabulary.lookup(phrase).orElseThrow();
                    switch (term.kind) {
                        case STAT:
                            if (stat != null) {
                                throw new ConditionParseException(source, phrase, "clause names more than one stat");
                            }
                            stat = term.factKey;
                            break;
                        case WIN:
                            if (loss) {
                                throw new ConditionParseException(source, phrase, "clause names both a win and a loss");
                            }
                            win = true;
                            break;
                        case LOSS:
                            if (win) {
                                throw new ConditionParseException(source, phrase, "clause names both a win and a loss");
                            }
                            loss = true;
                            break;
                        case HOME:
                            home = true;
                            break;
                        case AWAY:
                            away = true;
                            break;
                        default:
                            break;
                    }
                    i += consumed;
                    break;
                default:
                    throw new ConditionParseException(source, token.text, "unexpected token");
            }
        }

        if (threshold != null && stat == null) {
            throw new ConditionParseException(source, thresholdToken.text, "threshold without a stat");
        }
        boolean outcome = win || loss;
        if (!outcome && stat == null && !home && !away) {
            throw new ConditionParseException(source, tokens.get(0).text,
                "clause needs a win, a loss, a stat or a location");
        }

        List<Predicate> parts = new ArrayList<>();
        if (outcome) {
            parts.add(new Comparison(GameFact.IS_COMPLETE, ComparisonOperator.EQ, 1));
        }
        if (home) {
            parts.add(new Comparison(GameFact.IS_HOME, ComparisonOperator.EQ, 1));
        }
        if (away) {
            parts.add(new Comparison(GameFact.IS_HOME, ComparisonOperator.EQ, 0));
        }
        if (win) {
            parts.add(margin != null
                ? new Comparison(GameFact.RUN_DIFFERENTIAL, ComparisonOperator.GTE, margin)
                : new Comparison(GameFact.RUN_DIFFERENTIAL, ComparisonOperator.GT, 0));
        }
        if (loss) {
            parts.add(new Comparison(GameFact.RUN_DIFFERENTIAL, ComparisonOperator.LT, 0));
        }
        if (stat != null) {
            parts.add(threshold != null
                ? new Comparison(stat, operator, threshold)
                : new Comparison(stat, ComparisonOperator.GTE, 1));
        }
        Predicate predicate = parts.size() == 1 ? parts.get(0) : new Conjunction(parts);
        return new Clause(predicate, !outcome && stat == null);
    }

    // "by" at index byIndex; the margin is the next token, with or without a trailing '+'.
    private int parseMargin(String source, List<Token> tokens, int byIndex) {
        Token by = tokens.get(byIndex);
        if (byIndex + 1 >= tokens.size()) {
            throw new ConditionParseException(source, by.text, "margin needs a number");
        }
        Token amount = tokens.get(byIndex + 1);
        if (amount.type != TokenType.NUMBER && amount.type != TokenType.THRESHOLD) {
            throw new ConditionParseException(source, amount.text, "margin needs a number");
        }
        int margin = parseNumber(source, amount.type == TokenType.THRESHOLD ? stripPlus(amount.text) : amount.text);
        if (margin < 1) {
            throw new ConditionParseException(source, amount.text, "margin must be at least 1");
        }
        return margin;
    }

    private static String stripPlus(String threshold) {
        return threshold.substring(0, threshold.length() - 1);
    }

    private int wordRunEnd(List<Token> tokens, int start) {
        int end = start;
        while (end < tokens.size() && tokens.get(end).type == TokenType.WORD) {
            end++;
        }
        return end;
    }

    // Longest phrase starting at start wins, so "home runs" beats "home".
    private int matchPhrase(String source, List<Token> tokens, int start, int end) {
        int longest = Math.min(StatVocabulary.MAX_PHRASE_WORDS, end - start);
        for (int length = longest; length > 0; length--) {
            Optional<StatVocabulary.Term> term = StatVocabulary.lookup(joinWords(tokens, start, start + length));
            if (term.isPresent()) {
                return length;
            }
        }
        String word = tokens.get(start).text;
        throw new ConditionParseException(source, word,
            StatVocabulary.isKnownWord(word) ? "word is not valid here" : "unrecognized word");
    }

    private String joinWords(List<Token> tokens, int start, int end) {
        StringBuilder phrase = new StringBuilder();
        for (int i = start; i < end; i++) {
            if (i > start) {
                phrase.append(' ');
            }
            phrase.append(tokens.get(i).text);
        }
        return phrase.toString();
    }

    private int parseNumber(String source, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ConditionParseException(source, digits, "number out of range");
        }
    }

    private void addFlattened(List<Predicate> target, Predicate clause) {
        if (clause instanceof Conjunction) {
            target.addAll(((Conjunction) clause).getChildren());
        } else {
            target.add(clause);
        }
    }
}

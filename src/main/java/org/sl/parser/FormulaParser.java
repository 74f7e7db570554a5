package org.sl.parser;

import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.sl.antlr.SententialLogicLexer;
import org.sl.antlr.SententialLogicParser;
import org.sl.support.Formula;

import java.util.logging.Logger;

/**
 * PARSER FORMULE SL - Testo → {@link Formula} oppure {@link ParseError}
 *
 * Pipeline: rimozione spazi → Lexing → Parsing ANTLR → Visitor. Le formule binarie
 * devono essere racchiuse tra parentesi; per comodità la formula più esterna può
 * ometterle: se il testo non viene riconosciuto così com'è, si ritenta una sola
 * volta racchiudendolo in una coppia di parentesi.
 *
 * SINTASSI:
 * - Atomi: una lettera maiuscola A..Z
 * - Negazione: ~X
 * - Binari: (X &amp; Y), (X v Y), (X -&gt; Y), (X &lt;-&gt; Y)
 *
 * Ogni errore (lettere minuscole, parentesi sbilanciate, connettivi incompleti,
 * più connettivi nella stessa coppia di parentesi) produce un {@link ParseError}.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /** Profondità massima accettata: parser, visitor e model sono ricorsivi */
    static final int MAX_NESTING = 1000;

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Analizza il testo di una formula.
     *
     * @param text formula in notazione testuale (null trattato come errore)
     * @return formula riconosciuta o errore tipizzato, mai un'eccezione
     */
    public static ParseResult parse(String text) {
        if (text == null) {
            return ParseResult.failure(new ParseError("", "testo assente"));
        }

        String stripped = text.replaceAll("\\s+", "");
        LOGGER.fine("Parsing formula: " + stripped);

        int nesting = nestingBound(stripped);
        if (nesting > MAX_NESTING) {
            LOGGER.fine("Formula rifiutata: annidamento " + nesting);
            return ParseResult.failure(new ParseError(text,
                    "formula troppo annidata (oltre " + MAX_NESTING + " livelli)"));
        }

        Attempt direct = attempt(stripped);
        if (direct.formula != null) {
            return ParseResult.success(direct.formula);
        }

        // Ritenta con parentesi esterne per formule binarie non racchiuse
        Attempt wrapped = attempt("(" + stripped + ")");
        if (wrapped.formula != null) {
            LOGGER.finest("Formula riconosciuta dopo aggiunta parentesi esterne");
            return ParseResult.success(wrapped.formula);
        }

        LOGGER.fine("Formula rifiutata: " + direct.reason);
        return ParseResult.failure(new ParseError(text, direct.reason));
    }

    /**
     * Singolo tentativo di parsing senza ritentativi.
     */
    private static Attempt attempt(String text) {
        if (text.isEmpty()) {
            return new Attempt(null, "formula vuota");
        }

        try {
            SententialLogicLexer lexer = new SententialLogicLexer(CharStreams.fromString(text));
            lexer.removeErrorListeners();
            lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

            SententialLogicParser parser = new SententialLogicParser(new CommonTokenStream(lexer));
            parser.removeErrorListeners();
            parser.addErrorListener(SyntaxErrorListener.INSTANCE);
            parser.setErrorHandler(new BailErrorStrategy());

            return new Attempt(new FormulaBuilder().visit(parser.sentence()), null);

        } catch (ParseCancellationException e) {
            return new Attempt(null, describe(e));
        }
    }

    /**
     * Maggiorante della profondità dell'albero: negazioni totali più massima
     * profondità di parentesi (più uno per le parentesi del ritentativo).
     */
    private static int nestingBound(String text) {
        int negations = 0;
        int depth = 0;
        int maxDepth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '~') {
                negations++;
            } else if (c == '(') {
                maxDepth = Math.max(maxDepth, ++depth);
            } else if (c == ')') {
                depth--;
            }
        }
        return negations + maxDepth + 1;
    }

    private static String describe(ParseCancellationException e) {
        if (e.getMessage() != null) {
            return e.getMessage();
        }
        // BailErrorStrategy incapsula la RecognitionException senza messaggio
        if (e.getCause() instanceof RecognitionException) {
            Token token = ((RecognitionException) e.getCause()).getOffendingToken();
            if (token != null) {
                String symbol = token.getType() == Token.EOF ? "<EOF>" : "'" + token.getText() + "'";
                return "colonna " + token.getCharPositionInLine() + ": simbolo inatteso " + symbol;
            }
        }
        return "sintassi non riconosciuta";
    }

    private record Attempt(Formula formula, String reason) {}
}

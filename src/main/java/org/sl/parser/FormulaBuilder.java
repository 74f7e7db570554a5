package org.sl.parser;

import org.sl.antlr.SententialLogicBaseVisitor;
import org.sl.antlr.SententialLogicParser;
import org.sl.antlr.SententialLogicParser.AtomContext;
import org.sl.antlr.SententialLogicParser.BinaryContext;
import org.sl.antlr.SententialLogicParser.NegationContext;
import org.sl.antlr.SententialLogicParser.SentenceContext;
import org.sl.support.Formula;

import java.util.logging.Logger;

/**
 * COSTRUTTORE FORMULE - Visitor da albero sintattico ANTLR a {@link Formula}
 *
 * Attraversa l'albero prodotto dalla grammatica SententialLogic e costruisce
 * bottom-up l'albero immutabile della formula. La grammatica garantisce già la
 * struttura (un solo connettivo per coppia di parentesi), quindi il visitor si
 * limita a tradurre ogni alternativa nel nodo corrispondente.
 */
class FormulaBuilder extends SententialLogicBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitSentence(SentenceContext ctx) {
        Formula formula = visit(ctx.formula());
        LOGGER.finest("Albero costruito: " + formula + " (" + formula.size() + " nodi)");
        return formula;
    }

    //endregion

    //region ALTERNATIVE DELLA REGOLA formula

    @Override
    public Formula visitAtom(AtomContext ctx) {
        return Formula.atom(ctx.ATOM().getText().charAt(0));
    }

    @Override
    public Formula visitNegation(NegationContext ctx) {
        return Formula.negation(visit(ctx.formula()));
    }

    /**
     * Gestisce (X op Y) traducendo il token del connettivo nel tipo di nodo.
     */
    @Override
    public Formula visitBinary(BinaryContext ctx) {
        Formula left = visit(ctx.formula(0));
        Formula right = visit(ctx.formula(1));
        return Formula.binary(connectiveType(ctx.connective().getStart().getType()), left, right);
    }

    //endregion

    private static Formula.Type connectiveType(int tokenType) {
        return switch (tokenType) {
            case SententialLogicParser.AND -> Formula.Type.AND;
            case SententialLogicParser.OR -> Formula.Type.OR;
            case SententialLogicParser.IMPLIES -> Formula.Type.IMPLIES;
            case SententialLogicParser.IFF -> Formula.Type.IFF;
            default -> throw new IllegalStateException("Token connettivo inatteso: " + tokenType);
        };
    }
}

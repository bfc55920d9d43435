package org.modal.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.modal.antlr.ModalFormulaLexer;
import org.modal.antlr.ModalFormulaParser;

import java.util.logging.Logger;

/**
 * PARSER FORMULE MODALI - Pipeline completa testo -> {@link Formula}
 *
 * Collega lexer e parser generati da ANTLR al {@link FormulaBuilder}, sostituendo la
 * gestione errori predefinita (stampa su console e recupero) con un listener che
 * interrompe il parsing al primo errore sollevando {@link FormulaSyntaxException}.
 *
 * PIPELINE:
 * 1. Validazione input (null o vuoto)
 * 2. Lexing con segnalazione dei simboli sconosciuti
 * 3. Parsing con EOF obbligatorio (nessun simbolo residuo ammesso)
 * 4. Visita dell'albero sintattico e costruzione AST
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Converte il testo di una formula nel suo albero sintattico.
     *
     * @param text formula in notazione infissa (es. "[]p -> <>p")
     * @return albero della formula
     * @throws FormulaSyntaxException se il testo non è una formula ben formata
     */
    public static Formula parse(String text) {
        if (text == null || text.isBlank()) {
            throw new FormulaSyntaxException("Formula vuota");
        }

        LOGGER.fine("Parsing formula: " + text);

        CharStream input = CharStreams.fromString(text);
        ModalFormulaLexer lexer = new ModalFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        ModalFormulaParser parser = new ModalFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        ParseTree tree = parser.formula();
        return new FormulaBuilder().visit(tree);
    }

    /**
     * Listener che trasforma ogni errore di lexer o parser in eccezione.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            String offendingText = offendingSymbol instanceof Token token ? token.getText() : null;
            LOGGER.fine("Errore di sintassi alla colonna " + charPositionInLine + ": " + msg);
            throw new FormulaSyntaxException(msg, line, charPositionInLine, offendingText);
        }
    }
}

package org.csu.odesolve.engine;

import lombok.Getter;
import org.csu.odesolve.common.exception.EquationException;
import org.csu.odesolve.compiler.lexer.Lexer;
import org.csu.odesolve.compiler.lexer.Token;
import org.csu.odesolve.compiler.lexer.ValidationMode;
import org.csu.odesolve.compiler.normalizer.EquationNormalizer;
import org.csu.odesolve.compiler.parser.Parser;
import org.csu.odesolve.compiler.parser.ast.EquationNode;
import org.csu.odesolve.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * @author hidyouth
 *
 * 方程编译器: 词法分析 -> 语法分析 -> 规范化。
 */
public class EquationCompiler {

    @Getter
    private final ValidationMode mode;
    private final EquationNormalizer normalizer = new EquationNormalizer();
    private boolean verbose = false;

    public EquationCompiler() {
        this(ValidationMode.STRICT);
    }

    public EquationCompiler(ValidationMode mode) {
        this.mode = mode;
    }

    public EquationCompiler verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    /**
     * 编译方程，失败时抛出 {@link EquationException} 的子类。
     */
    public CompiledEquation parse(String text) {
        Lexer lexer = new Lexer(text, mode);
        List<Token> tokens = lexer.tokenize();
        if (verbose) {
            System.out.println("[Compiler] Tokens: " + tokens);
        }

        EquationNode ast = new Parser(tokens).parse();
        if (verbose) {
            System.out.println("[Compiler] AST:\n" + ExpressionPrinter.dump(ast));
        }

        ExpressionNode expression = normalizer.normalize(ast);
        CompiledEquation equation = new CompiledEquation(lexer.getInput(), expression);
        if (verbose) {
            System.out.println("[Compiler] Normalized: " + equation);
        }
        return equation;
    }

    /**
     * 与 {@link #parse(String)} 相同，但以结果对象的形式返回失败。
     */
    public ParseResult tryParse(String text) {
        try {
            return ParseResult.success(parse(text));
        } catch (EquationException e) {
            return ParseResult.failure(e);
        }
    }
}

package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.attribute.TreeQueries;
import ch.epfl.vlsc.vhdl.attribute.TypeAnnotations;
import ch.epfl.vlsc.vhdl.ir.IRNode;
import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.ir.design.EdgeSensitivity;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtIf;
import ch.epfl.vlsc.vhdl.platform.ConversionContext;
import ch.epfl.vlsc.vhdl.platformutils.Emitter;
import ch.epfl.vlsc.vhdl.platformutils.utils.Box;
import ch.epfl.vlsc.vhdl.settings.Configuration;
import ch.epfl.vlsc.vhdl.settings.VhdlSettings;
import ch.epfl.vlsc.vhdl.type.VhdlType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the state of the VHDL code generation of one design and gives access to the generator modules.
 */
public class VhdlBackend {
    private final Design task;
    private final ConversionContext context;
    private final Deque<Emitter> emitters = new ArrayDeque<>();
    private final Deque<Process> processes = new ArrayDeque<>();

    // -- Types imposed by the code generator on top of the inferred ones
    private final Map<IRNode, VhdlType> coercions = new IdentityHashMap<>();

    // -- Clock edges folded into the else branch of an asynchronous reset test
    private final Map<StmtIf, List<EdgeSensitivity>> edgeRewrites = new IdentityHashMap<>();

    // -- Bodies of the called functions and procedures, in completion order
    private final List<String> callableTexts = new ArrayList<>();

    private final Box<Boolean> encodingAttributeBox = Box.of(false);

    private TypesEvaluator typeseval;
    private Declarations declarations;
    private ExpressionEvaluator expressioneval;
    private LValues lvalues;
    private Statements statements;
    private CaseStatements casestatements;
    private Processes processesgen;
    private Callables callables;
    private Architecture architecture;

    public VhdlBackend(Design task, ConversionContext context, Emitter emitter) {
        this.task = task;
        this.context = context;
        this.emitters.push(emitter);
    }

    public Design task() {
        return task;
    }

    public ConversionContext context() {
        return context;
    }

    public Configuration configuration() {
        return context.getConfiguration();
    }

    public TypeAnnotations annotations() {
        return context.getAnnotations();
    }

    public TreeQueries queries() {
        return context.getQueries();
    }

    // -- Emitter
    public Emitter emitter() {
        return emitters.peek();
    }

    /**
     * A new emitter with the configured indentation.
     */
    public Emitter newEmitter() {
        return new Emitter(configuration().get(VhdlSettings.indentationWidth));
    }

    public void pushEmitter(Emitter emitter) {
        emitters.push(emitter);
    }

    public void popEmitter() {
        if (emitters.size() == 1) {
            throw new IllegalStateException("Cannot pop the output emitter");
        }
        emitters.pop();
    }

    // -- Process currently written
    public Process process() {
        if (processes.isEmpty()) {
            throw new IllegalStateException("No process is being generated");
        }
        return processes.peek();
    }

    public void enter(Process process) {
        processes.push(process);
    }

    public void leave() {
        processes.pop();
    }

    public Map<IRNode, VhdlType> coercions() {
        return coercions;
    }

    /**
     * The type an expression must be written as: imposed by the code generator, or else inferred.
     */
    public VhdlType viewOf(IRNode node) {
        VhdlType coerced = coercions.get(node);
        return coerced != null ? coerced : annotations().typeOf(node);
    }

    public Map<StmtIf, List<EdgeSensitivity>> edgeRewrites() {
        return edgeRewrites;
    }

    public List<String> callableTexts() {
        return callableTexts;
    }

    public Box<Boolean> encodingAttributeBox() {
        return encodingAttributeBox;
    }

    // -- Types evaluator
    public TypesEvaluator typeseval() {
        if (typeseval == null) {
            typeseval = () -> this;
        }
        return typeseval;
    }

    // -- Declarations
    public Declarations declarations() {
        if (declarations == null) {
            declarations = () -> this;
        }
        return declarations;
    }

    // -- Expression Evaluator
    public ExpressionEvaluator expressioneval() {
        if (expressioneval == null) {
            expressioneval = () -> this;
        }
        return expressioneval;
    }

    // -- Assignment targets
    public LValues lvalues() {
        if (lvalues == null) {
            lvalues = () -> this;
        }
        return lvalues;
    }

    // -- Statements
    public Statements statements() {
        if (statements == null) {
            statements = () -> this;
        }
        return statements;
    }

    // -- Case statements
    public CaseStatements casestatements() {
        if (casestatements == null) {
            casestatements = () -> this;
        }
        return casestatements;
    }

    // -- Processes
    public Processes processes() {
        if (processesgen == null) {
            processesgen = () -> this;
        }
        return processesgen;
    }

    // -- Callables
    public Callables callables() {
        if (callables == null) {
            callables = () -> this;
        }
        return callables;
    }

    // -- Architecture
    public Architecture architecture() {
        if (architecture == null) {
            architecture = () -> this;
        }
        return architecture;
    }
}

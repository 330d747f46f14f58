package ch.epfl.vlsc.vhdl.phase;

import ch.epfl.vlsc.vhdl.attribute.TreeQueries;
import ch.epfl.vlsc.vhdl.attribute.TypeAnnotations;
import ch.epfl.vlsc.vhdl.ir.IRNode;
import ch.epfl.vlsc.vhdl.ir.design.Constant;
import ch.epfl.vlsc.vhdl.ir.design.DesignObject;
import ch.epfl.vlsc.vhdl.ir.design.EnumItem;
import ch.epfl.vlsc.vhdl.ir.design.EnumType;
import ch.epfl.vlsc.vhdl.ir.design.Memory;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.ProcessKind;
import ch.epfl.vlsc.vhdl.ir.design.Rom;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.ValueKind;
import ch.epfl.vlsc.vhdl.ir.design.Variable;
import ch.epfl.vlsc.vhdl.ir.expr.ExprApplication;
import ch.epfl.vlsc.vhdl.ir.expr.ExprBinaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprBoolOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprComparison;
import ch.epfl.vlsc.vhdl.ir.expr.ExprEdge;
import ch.epfl.vlsc.vhdl.ir.expr.ExprEnumItem;
import ch.epfl.vlsc.vhdl.ir.expr.ExprIndexer;
import ch.epfl.vlsc.vhdl.ir.expr.ExprLiteral;
import ch.epfl.vlsc.vhdl.ir.expr.ExprSlice;
import ch.epfl.vlsc.vhdl.ir.expr.ExprUnaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprVariable;
import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.ir.stmt.IfBranch;
import ch.epfl.vlsc.vhdl.ir.stmt.Statement;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAssert;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAssignment;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAugmentedAssignment;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtBreak;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtCall;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtContinue;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtFor;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtIf;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtPass;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtPrint;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtReturn;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtStopSimulation;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtWait;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtWhile;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValue;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueIndexer;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueNext;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueSlice;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueVariable;
import ch.epfl.vlsc.vhdl.reporting.CompilationException;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.type.BitType;
import ch.epfl.vlsc.vhdl.type.BoolType;
import ch.epfl.vlsc.vhdl.type.EnumeratedType;
import ch.epfl.vlsc.vhdl.type.IntType;
import ch.epfl.vlsc.vhdl.type.SignedType;
import ch.epfl.vlsc.vhdl.type.TypeAlgebra;
import ch.epfl.vlsc.vhdl.type.UnsignedType;
import ch.epfl.vlsc.vhdl.type.VectorType;
import ch.epfl.vlsc.vhdl.type.VhdlType;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Bottom-up type inference over the body of one process. Called functions and procedures are
 * inferred once, the first time a call to them is met.
 */
class TypeInference implements Expression.Visitor<VhdlType>, Statement.Visitor, LValue.Visitor<VhdlType> {
    private final Process process;
    private final TreeQueries queries;
    private final TypeAnnotations.Builder annotations;
    private final Set<Process> inferred;
    private final Deque<String> loopVariables = new ArrayDeque<>();
    private int loopDepth;

    TypeInference(Process process, TreeQueries queries, TypeAnnotations.Builder annotations, Set<Process> inferred) {
        this.process = process;
        this.queries = queries;
        this.annotations = annotations;
        this.inferred = inferred;
    }

    void run() {
        if (!inferred.add(process)) {
            return;
        }
        body(process.getBody());
    }

    private void body(List<Statement> statements) {
        for (Statement statement : statements) {
            statement.accept(this);
        }
    }

    private VhdlType infer(Expression expression) {
        VhdlType type = expression.accept(this);
        annotations.set(expression, type);
        return type;
    }

    private VhdlType infer(LValue lvalue) {
        VhdlType type = lvalue.accept(this);
        annotations.set(lvalue, type);
        return type;
    }

    private void force(IRNode node, VhdlType type) {
        annotations.set(node, type);
    }

    private CompilationException error(IRNode node, ConversionErrors error, String detail) {
        return queries.error(node, error, detail);
    }

    private Optional<DesignObject> lookup(String name) {
        return queries.lookup(process, name);
    }

    private DesignObject resolve(IRNode node, String name) {
        return queries.resolve(process, node, name);
    }

    private boolean isLoopVariable(String name) {
        return loopVariables.contains(name);
    }

    /**
     * Operators only defined on non-negative values cannot be applied to a signed name.
     */
    private void checkNotSigned(Expression operand, String operator) {
        if (operand instanceof ExprVariable && !isLoopVariable(((ExprVariable) operand).getName())) {
            Optional<DesignObject> object = lookup(((ExprVariable) operand).getName());
            if (object.isPresent() && kindOf(object.get()) == ValueKind.SIGNED) {
                throw error(operand, ConversionErrors.NOT_SUPPORTED,
                        String.format("operator %s on the signed vector %s", operator, ((ExprVariable) operand).getName()));
            }
        }
    }

    private static ValueKind kindOf(DesignObject object) {
        if (object instanceof Signal) {
            return ((Signal) object).getKind();
        } else if (object instanceof Variable) {
            return ((Variable) object).getKind();
        }
        return null;
    }

    private VhdlType typeOf(IRNode node, DesignObject object, String name) {
        if (object instanceof Signal) {
            return TypeAlgebra.of((Signal) object);
        } else if (object instanceof Variable) {
            return TypeAlgebra.of((Variable) object);
        } else if (object instanceof Constant) {
            return ((Constant) object).isBool() ? BitType.INSTANCE : IntType.INSTANCE;
        } else if (object instanceof EnumItem) {
            return new EnumeratedType(((EnumItem) object).getType());
        } else if (object instanceof Memory) {
            annotations.referenced((Memory) object);
            return TypeAlgebra.of(((Memory) object).getElement());
        } else if (object instanceof Rom) {
            return IntType.INSTANCE;
        }
        throw error(node, ConversionErrors.UNSUPPORTED_TYPE, name);
    }

    // -- Expressions

    @Override
    public VhdlType visit(ExprLiteral literal) {
        switch (literal.getKind()) {
            case TRUE:
            case FALSE:
                return BitType.INSTANCE;
            default:
                return IntType.INSTANCE;
        }
    }

    @Override
    public VhdlType visit(ExprVariable variable) {
        if (isLoopVariable(variable.getName())) {
            return IntType.INSTANCE;
        }
        return typeOf(variable, resolve(variable, variable.getName()), variable.getName());
    }

    @Override
    public VhdlType visit(ExprEdge edge) {
        DesignObject object = resolve(edge, edge.getSignal());
        if (!(object instanceof Signal) || ((Signal) object).getKind() != ValueKind.BOOL) {
            throw error(edge, ConversionErrors.UNSUPPORTED_TYPE, "edge of " + edge.getSignal());
        }
        return BoolType.INSTANCE;
    }

    @Override
    public VhdlType visit(ExprEnumItem item) {
        DesignObject object = resolve(item, item.getType());
        if (!(object instanceof EnumType)) {
            throw error(item, ConversionErrors.UNSUPPORTED_TYPE, item.getType() + " is not an enumeration");
        }
        EnumType type = (EnumType) object;
        if (!type.getItem(item.getItem()).isPresent()) {
            throw error(item, ConversionErrors.UNDEFINED_NAME, item.getType() + "." + item.getItem());
        }
        return new EnumeratedType(type);
    }

    @Override
    public VhdlType visit(ExprBinaryOp binaryOp) {
        VhdlType left = infer(binaryOp.getLeft());
        VhdlType right = infer(binaryOp.getRight());
        ExprBinaryOp.Operator operator = binaryOp.getOperator();
        if (operator.isArithmetic()) {
            return TypeAlgebra.arithmetic(left, right);
        } else if (operator.isShift()) {
            force(binaryOp.getRight(), IntType.INSTANCE);
            return left;
        } else if (operator.isBitwise()) {
            checkNotSigned(binaryOp.getLeft(), operator.getSymbol());
            checkNotSigned(binaryOp.getRight(), operator.getSymbol());
            VhdlType combined = TypeAlgebra.combine(left, right).orElseThrow(() ->
                    error(binaryOp, ConversionErrors.UNSUPPORTED_TYPE, left + " " + operator.getSymbol() + " " + right));
            force(binaryOp.getLeft(), combined);
            force(binaryOp.getRight(), combined);
            return combined;
        }
        // -- power
        return IntType.INSTANCE;
    }

    @Override
    public VhdlType visit(ExprBoolOp boolOp) {
        for (Expression operand : boolOp.getOperands()) {
            checkNotSigned(operand, boolOp.getOperator().name().toLowerCase());
            infer(operand);
            force(operand, BoolType.INSTANCE);
        }
        return BoolType.INSTANCE;
    }

    @Override
    public VhdlType visit(ExprUnaryOp unaryOp) {
        VhdlType operand = infer(unaryOp.getOperand());
        switch (unaryOp.getOperator()) {
            case NOT:
                checkNotSigned(unaryOp.getOperand(), "not");
                force(unaryOp.getOperand(), BoolType.INSTANCE);
                return BoolType.INSTANCE;
            case INVERT:
                checkNotSigned(unaryOp.getOperand(), "~");
                return operand;
            default:
                return operand;
        }
    }

    @Override
    public VhdlType visit(ExprComparison comparison) {
        VhdlType left = infer(comparison.getLeft());
        VhdlType right = infer(comparison.getRight());
        VhdlType combined = TypeAlgebra.combine(left, right).orElseThrow(() ->
                error(comparison, ConversionErrors.UNSUPPORTED_TYPE, "comparing " + left + " with " + right));
        force(comparison.getLeft(), combined);
        force(comparison.getRight(), combined);
        if (combined instanceof SignedType) {
            annotations.signedContext(comparison);
        }
        return BoolType.INSTANCE;
    }

    @Override
    public VhdlType visit(ExprIndexer indexer) {
        VhdlType structure = infer(indexer.getStructure());
        infer(indexer.getIndex());
        force(indexer.getIndex(), IntType.INSTANCE);
        Optional<DesignObject> object = structureObject(indexer.getStructure());
        if (object.isPresent() && object.get() instanceof Memory) {
            return TypeAlgebra.of(((Memory) object.get()).getElement());
        } else if (object.isPresent() && object.get() instanceof Rom) {
            return IntType.INSTANCE;
        } else if (structure.isVector()) {
            return BitType.INSTANCE;
        }
        throw error(indexer, ConversionErrors.UNSUPPORTED_TYPE, "indexing a value of type " + structure);
    }

    private Optional<DesignObject> structureObject(Expression structure) {
        if (structure instanceof ExprVariable && !isLoopVariable(((ExprVariable) structure).getName())) {
            return lookup(((ExprVariable) structure).getName());
        }
        return Optional.empty();
    }

    @Override
    public VhdlType visit(ExprSlice slice) {
        VhdlType structure = infer(slice.getStructure());
        VectorType result;
        if (structure instanceof VectorType) {
            result = (VectorType) structure;
        } else if (structure instanceof IntType) {
            result = new UnsignedType(0);
        } else {
            throw error(slice, ConversionErrors.UNSUPPORTED_TYPE, "slicing a value of type " + structure);
        }
        int high;
        if (slice.getHigh().isPresent()) {
            infer(slice.getHigh().get());
            high = queries.constantInt(process, slice.getHigh().get());
        } else if (structure instanceof VectorType) {
            high = structure.getSize();
        } else {
            throw error(slice, ConversionErrors.NOT_CONSTANT, "slice of an integer needs an upper bound");
        }
        int low = 0;
        if (slice.getLow().isPresent()) {
            infer(slice.getLow().get());
            low = queries.constantInt(process, slice.getLow().get());
        }
        if (high <= low) {
            throw error(slice, ConversionErrors.STRUCTURE, String.format("empty slice [%d:%d]", high, low));
        }
        return result.withSize(high - low);
    }

    @Override
    public VhdlType visit(ExprApplication application) {
        return inferCall(application, false);
    }

    private VhdlType inferCall(ExprApplication application, boolean statement) {
        DesignObject callee = process.getSymbols().get(application.getFunction());
        if (callee instanceof Process) {
            return inferCallable(application, (Process) callee, statement);
        }
        if (statement) {
            throw error(application, ConversionErrors.NOT_SUPPORTED, "call of " + application.getFunction() + " as a statement");
        }
        List<Expression> args = application.getArgs();
        switch (application.getFunction()) {
            case "bool":
                checkArity(application, 1, 1);
                infer(args.get(0));
                return BoolType.INSTANCE;
            case "len":
                checkArity(application, 1, 1);
                infer(args.get(0));
                queries.constantInt(process, application);
                return IntType.INSTANCE;
            case "int":
                checkArity(application, 1, 1);
                infer(args.get(0));
                force(args.get(0), IntType.INSTANCE);
                return IntType.INSTANCE;
            case "intbv":
                checkArity(application, 1, 3);
                args.forEach(this::infer);
                return IntType.INSTANCE;
            case "concat":
                checkArity(application, 1, Integer.MAX_VALUE);
                int size = 0;
                for (Expression arg : args) {
                    VhdlType type = infer(arg);
                    if (!(type instanceof BitType) && !type.isVector()) {
                        throw error(arg, ConversionErrors.UNSUPPORTED_TYPE, "concat of a value without a width");
                    }
                    size += type.getSize();
                }
                return new UnsignedType(size);
            default:
                throw error(application, ConversionErrors.NOT_SUPPORTED, "call of " + application.getFunction());
        }
    }

    private void checkArity(ExprApplication application, int min, int max) {
        int n = application.getArgs().size();
        if (n < min || n > max) {
            throw error(application, ConversionErrors.NOT_SUPPORTED,
                    String.format("%s with %d arguments", application.getFunction(), n));
        }
    }

    private VhdlType inferCallable(ExprApplication application, Process callee, boolean statement) {
        if (!callee.getKind().isCallable()) {
            throw error(application, ConversionErrors.NOT_SUPPORTED, "call of the process " + callee.getName());
        }
        if (application.getArgs().size() != callee.getParameters().size()) {
            throw error(application, ConversionErrors.ARG_TYPE,
                    String.format("%s expects %d arguments", callee.getName(), callee.getParameters().size()));
        }
        application.getArgs().forEach(this::infer);
        new TypeInference(callee, queries, annotations, inferred).run();
        if (statement && callee.getKind() == ProcessKind.FUNCTION) {
            throw error(application, ConversionErrors.NOT_SUPPORTED, "result of function " + callee.getName() + " is ignored");
        }
        if (callee.getKind() == ProcessKind.PROCEDURE) {
            if (!statement) {
                throw error(application, ConversionErrors.NOT_SUPPORTED, "procedure " + callee.getName() + " used as a value");
            }
            return IntType.INSTANCE;
        }
        Variable result = callee.getReturnValue().orElseThrow(() ->
                error(application, ConversionErrors.STRUCTURE, "function " + callee.getName() + " has no return type"));
        return TypeAlgebra.of(result);
    }

    // -- Statements

    @Override
    public void visit(StmtAssignment assignment) {
        infer(assignment.getTarget());
        infer(assignment.getValue());
    }

    @Override
    public void visit(StmtAugmentedAssignment assignment) {
        if (!assignment.getOperator().getBinary().isPresent()) {
            throw error(assignment, ConversionErrors.NOT_SUPPORTED,
                    "augmented assignment operator " + assignment.getOperator().name().toLowerCase());
        }
        infer(assignment.getTarget());
        infer(assignment.getValue());
        if (assignment.getOperator().getBinary().get().isShift()) {
            force(assignment.getValue(), IntType.INSTANCE);
        }
    }

    @Override
    public void visit(StmtIf stmt) {
        for (IfBranch branch : stmt.getBranches()) {
            infer(branch.getCondition());
            force(branch.getCondition(), BoolType.INSTANCE);
            body(branch.getBody());
        }
        stmt.getElseBranch().ifPresent(this::body);
    }

    @Override
    public void visit(StmtFor stmt) {
        for (Optional<Expression> bound : Arrays.asList(stmt.getStart(), stmt.getStop(), stmt.getStep())) {
            if (bound.isPresent()) {
                infer(bound.get());
                queries.constantInt(process, bound.get());
            }
        }
        if (stmt.getStep().isPresent() && queries.constantInt(process, stmt.getStep().get()) != 1) {
            throw error(stmt, ConversionErrors.LOOP_STEP, "in the loop over " + stmt.getVariable());
        }
        if (stmt.getDirection() == StmtFor.Direction.ASCENDING && !stmt.getStop().isPresent()
                || stmt.getDirection() == StmtFor.Direction.DESCENDING && !stmt.getStart().isPresent()) {
            throw error(stmt, ConversionErrors.STRUCTURE, "loop over " + stmt.getVariable() + " has no bound");
        }
        annotations.loopVariable(process, stmt.getVariable());
        loopVariables.push(stmt.getVariable());
        loopDepth++;
        body(stmt.getBody());
        loopDepth--;
        loopVariables.pop();
    }

    @Override
    public void visit(StmtWhile stmt) {
        infer(stmt.getCondition());
        force(stmt.getCondition(), BoolType.INSTANCE);
        loopDepth++;
        body(stmt.getBody());
        loopDepth--;
    }

    @Override
    public void visit(StmtBreak stmt) {
        if (loopDepth == 0) {
            throw error(stmt, ConversionErrors.STRUCTURE, "break outside of a loop");
        }
    }

    @Override
    public void visit(StmtContinue stmt) {
        if (loopDepth == 0) {
            throw error(stmt, ConversionErrors.STRUCTURE, "continue outside of a loop");
        }
    }

    @Override
    public void visit(StmtReturn stmt) {
        if (!process.getKind().isCallable()) {
            throw error(stmt, ConversionErrors.NOT_SUPPORTED, "return in process " + process.getName());
        }
        if (stmt.getValue().isPresent()) {
            if (process.getKind() == ProcessKind.PROCEDURE) {
                throw error(stmt, ConversionErrors.NOT_SUPPORTED, "procedure " + process.getName() + " returning a value");
            }
            infer(stmt.getValue().get());
        } else if (process.getKind() == ProcessKind.FUNCTION) {
            throw error(stmt, ConversionErrors.STRUCTURE, "function " + process.getName() + " must return a value");
        }
    }

    @Override
    public void visit(StmtCall call) {
        VhdlType type = inferCall(call.getCall(), true);
        annotations.set(call.getCall(), type);
    }

    @Override
    public void visit(StmtPass stmt) {
    }

    @Override
    public void visit(StmtPrint print) {
        print.getItems().forEach(this::infer);
    }

    @Override
    public void visit(StmtStopSimulation stmt) {
    }

    @Override
    public void visit(StmtAssert stmt) {
        infer(stmt.getCondition());
        force(stmt.getCondition(), BoolType.INSTANCE);
    }

    @Override
    public void visit(StmtWait stmt) {
        if (process.getKind() != ProcessKind.INITIAL) {
            throw error(stmt, ConversionErrors.NOT_SUPPORTED, "wait statement in " + process);
        }
    }

    // -- Assignment targets

    @Override
    public VhdlType visit(LValueVariable variable) {
        if (isLoopVariable(variable.getName())) {
            throw error(variable, ConversionErrors.NOT_SUPPORTED, "assignment to the loop index " + variable.getName());
        }
        DesignObject object = resolve(variable, variable.getName());
        if (object instanceof Signal || object instanceof Variable || object instanceof Memory) {
            return typeOf(variable, object, variable.getName());
        }
        throw error(variable, ConversionErrors.UNSUPPORTED_TYPE, "assignment to " + variable.getName());
    }

    @Override
    public VhdlType visit(LValueNext next) {
        return infer(next.getTarget());
    }

    @Override
    public VhdlType visit(LValueIndexer indexer) {
        VhdlType structure = infer(indexer.getStructure());
        infer(indexer.getIndex());
        force(indexer.getIndex(), IntType.INSTANCE);
        Optional<DesignObject> object = lookup(indexer.getStructure().getRootName());
        if (isMemoryTarget(indexer.getStructure()) && object.isPresent() && object.get() instanceof Memory) {
            return TypeAlgebra.of(((Memory) object.get()).getElement());
        } else if (structure.isVector()) {
            return BitType.INSTANCE;
        }
        throw error(indexer, ConversionErrors.UNSUPPORTED_TYPE, "indexing a value of type " + structure);
    }

    private static boolean isMemoryTarget(LValue structure) {
        if (structure instanceof LValueNext) {
            return isMemoryTarget(((LValueNext) structure).getTarget());
        }
        return structure instanceof LValueVariable;
    }

    @Override
    public VhdlType visit(LValueSlice slice) {
        VhdlType structure = infer(slice.getStructure());
        if (!(structure instanceof VectorType)) {
            throw error(slice, ConversionErrors.UNSUPPORTED_TYPE, "slicing a value of type " + structure);
        }
        int high = structure.getSize();
        if (slice.getHigh().isPresent()) {
            infer(slice.getHigh().get());
            high = queries.constantInt(process, slice.getHigh().get());
        }
        int low = 0;
        if (slice.getLow().isPresent()) {
            infer(slice.getLow().get());
            low = queries.constantInt(process, slice.getLow().get());
        }
        if (high <= low) {
            throw error(slice, ConversionErrors.STRUCTURE, String.format("empty slice [%d:%d]", high, low));
        }
        return ((VectorType) structure).withSize(high - low);
    }
}

package com.galois.multifunction.procedure;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import org.junit.Assert;
import org.junit.Test;

import com.galois.multifunction.DataType;
import com.galois.multifunction.ParamType.InterfaceType;

public class TestProcedureValidator {
    /**
     * Wire <code>call -> destruct(each variable) -> return</code> and make
     * the call the entry.
     */
    private static void finishWithDestructs(Procedure p, CallInstruction call, Variable... toDestruct) {
        Instruction last = call;
        for (Variable v : toDestruct) {
            DestructInstruction d = p.newDestructInstruction();
            d.setVariable(v);
            setNext(last, d);
            last = d;
        }
        setNext(last, p.newReturnInstruction());
        p.setEntry(call);
    }

    private static void setNext(Instruction from, Instruction to) {
        if (from instanceof CallInstruction) {
            ((CallInstruction) from).setNext(to);
        } else {
            ((DestructInstruction) from).setNext(to);
        }
    }

    @Test
    public void outputThenDestructIsValid() {
        Procedure p = SampleProcedures.outputThenDestruct();
        Assert.assertTrue(p.validate());
        p.assertValid();
    }

    @Test
    public void loopIsValid() {
        Assert.assertTrue(SampleProcedures.loop().validate());
    }

    @Test
    public void missingEntry() {
        Procedure p = new Procedure();
        p.newReturnInstruction();
        Assert.assertFalse(p.validate());
        Assert.assertTrue(p.validateAllInstructionPointersSet());
        Assert.assertTrue(p.validateInitialization());
    }

    @Test
    public void emptyProcedureThatReturnsIsValid() {
        Procedure p = new Procedure();
        p.setEntry(p.newReturnInstruction());
        Assert.assertTrue(p.validate());
    }

    @Test
    public void missingNextInstruction() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        CallInstruction call = p.newCallInstruction(SampleFunctions.CONSTANT);
        call.setParamVariable(0, v);
        p.setEntry(call);
        Assert.assertFalse(p.validateAllInstructionPointersSet());
        Assert.assertFalse(p.validate());
    }

    @Test
    public void missingFalseBranch() {
        Procedure p = new Procedure();
        Variable cond = p.newVariable(DataType.BOOL, "cond");
        p.addParameter(InterfaceType.INPUT, cond);
        BranchInstruction branch = p.newBranchInstruction();
        branch.setCondition(cond);
        DestructInstruction destruct = p.newDestructInstruction();
        destruct.setVariable(cond);
        destruct.setNext(p.newReturnInstruction());
        branch.setBranchTrue(destruct);
        p.setEntry(branch);
        Assert.assertFalse(p.validateAllInstructionPointersSet());

        branch.setBranchFalse(destruct);
        Assert.assertTrue(p.validateAllInstructionPointersSet());
        Assert.assertTrue(p.validate());
    }

    @Test
    public void missingCallVariable() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        p.addParameter(InterfaceType.INPUT, v);
        CallInstruction call = p.newCallInstruction(SampleFunctions.ADD);
        call.setParamVariable(0, v);
        call.setParamVariable(1, v);
        finishWithDestructs(p, call, v);
        Assert.assertTrue(p.validateAllInstructionPointersSet());
        Assert.assertFalse(p.validateAllParamsProvided());
        Assert.assertFalse(p.validate());
    }

    @Test
    public void missingBranchConditionAndDestructVariable() {
        Procedure p = new Procedure();
        BranchInstruction branch = p.newBranchInstruction();
        ReturnInstruction ret = p.newReturnInstruction();
        branch.setBranchTrue(ret);
        branch.setBranchFalse(ret);
        p.setEntry(branch);
        Assert.assertFalse(p.validateAllParamsProvided());

        Procedure q = new Procedure();
        DestructInstruction destruct = q.newDestructInstruction();
        destruct.setNext(q.newReturnInstruction());
        q.setEntry(destruct);
        Assert.assertFalse(q.validateAllParamsProvided());
    }

    @Test
    public void sameVariableAsTwoInputsIsValid() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        Variable r = p.newVariable(DataType.FLOAT, "r");
        p.addParameter(InterfaceType.INPUT, v);
        CallInstruction call = p.newCallInstruction(SampleFunctions.ADD);
        call.setParams(v, v, r);
        finishWithDestructs(p, call, r, v);

        Assert.assertTrue(p.validateSameVariablesInOneCall());
        Assert.assertTrue(p.validate());
    }

    @Test
    public void sameVariableAsInputAndOutputIsInvalid() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        p.addParameter(InterfaceType.INPUT, v);
        CallInstruction call = p.newCallInstruction(SampleFunctions.NEGATE);
        call.setParams(v, v);
        finishWithDestructs(p, call, v);

        Assert.assertFalse(p.validateSameVariablesInOneCall());
        Assert.assertFalse(p.validate());
    }

    @Test
    public void sameVariableAsTwoOutputsIsInvalid() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        CallInstruction call = p.newCallInstruction(SampleFunctions.TWO_CONSTANTS);
        call.setParams(v, v);
        finishWithDestructs(p, call, v);

        Assert.assertFalse(p.validateSameVariablesInOneCall());
        Assert.assertFalse(p.validate());
    }

    @Test
    public void sameVariableAsMutableAndInputIsInvalid() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        p.addParameter(InterfaceType.MUTABLE, v);
        CallInstruction call = p.newCallInstruction(SampleFunctions.INCREMENT_BY);
        call.setParams(v, v);
        finishWithDestructs(p, call);

        Assert.assertFalse(p.validateSameVariablesInOneCall());
    }

    @Test
    public void variableBoundToTwoParameters() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        Variable w = p.newVariable(DataType.FLOAT, "w");
        p.addParameter(InterfaceType.INPUT, v);
        p.addParameter(InterfaceType.OUTPUT, w);
        Assert.assertTrue(p.validateParameters());

        p.addParameter(InterfaceType.OUTPUT, v);
        Assert.assertFalse(p.validateParameters());
    }

    @Test
    public void useBeforeInitialization() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        Variable r = p.newVariable(DataType.FLOAT, "r");
        CallInstruction call = p.newCallInstruction(SampleFunctions.NEGATE);
        call.setParams(v, r);
        finishWithDestructs(p, call, r);

        Assert.assertTrue(p.validateAllInstructionPointersSet());
        Assert.assertTrue(p.validateAllParamsProvided());
        Assert.assertFalse(p.validateInitialization());
        Assert.assertFalse(p.validate());

        InitState state = p.findInitializationStateBeforeInstruction(call, v);
        Assert.assertFalse(state.canBeInitialized());
        Assert.assertTrue(state.canBeUninitialized());
    }

    @Test
    public void inputParameterIsInitializedAtEntry() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        Variable r = p.newVariable(DataType.FLOAT, "r");
        p.addParameter(InterfaceType.INPUT, v);
        p.addParameter(InterfaceType.OUTPUT, r);
        CallInstruction call = p.newCallInstruction(SampleFunctions.NEGATE);
        call.setParams(v, r);
        finishWithDestructs(p, call, v);

        InitState state = p.findInitializationStateBeforeInstruction(call, v);
        Assert.assertTrue(state.canBeInitialized());
        Assert.assertFalse(state.canBeUninitialized());
        state = p.findInitializationStateBeforeInstruction(call, r);
        Assert.assertFalse(state.canBeInitialized());
        Assert.assertTrue(state.canBeUninitialized());
        Assert.assertTrue(p.validate());
    }

    @Test
    public void outputVariableLeakedOnReturn() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        CallInstruction call = p.newCallInstruction(SampleFunctions.CONSTANT);
        call.setParamVariable(0, v);
        finishWithDestructs(p, call);

        Assert.assertFalse(p.validateInitialization());
        Assert.assertFalse(p.validate());
    }

    @Test
    public void outputParameterMayStayInitializedOnReturn() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        p.addParameter(InterfaceType.OUTPUT, v);
        CallInstruction call = p.newCallInstruction(SampleFunctions.CONSTANT);
        call.setParamVariable(0, v);
        finishWithDestructs(p, call);

        Assert.assertTrue(p.validate());
    }

    @Test
    public void outputParameterMustBeInitializedOnReturn() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        p.addParameter(InterfaceType.OUTPUT, v);
        p.setEntry(p.newReturnInstruction());

        Assert.assertFalse(p.validateInitialization());
    }

    @Test
    public void inputParameterMustBeDestructedBeforeReturn() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        p.addParameter(InterfaceType.INPUT, v);
        p.setEntry(p.newReturnInstruction());

        Assert.assertFalse(p.validateInitialization());
    }

    @Test
    public void outputToInitializedVariable() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        CallInstruction first = p.newCallInstruction(SampleFunctions.CONSTANT);
        CallInstruction second = p.newCallInstruction(SampleFunctions.CONSTANT);
        first.setParamVariable(0, v);
        second.setParamVariable(0, v);
        first.setNext(second);
        finishWithDestructs(p, second, v);
        p.setEntry(first);

        InitState state = p.findInitializationStateBeforeInstruction(second, v);
        Assert.assertTrue(state.canBeInitialized());
        Assert.assertFalse(state.canBeUninitialized());
        Assert.assertFalse(p.validateInitialization());
    }

    @Test
    public void destructOfUninitializedVariable() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        DestructInstruction destruct = p.newDestructInstruction();
        destruct.setVariable(v);
        destruct.setNext(p.newReturnInstruction());
        p.setEntry(destruct);

        Assert.assertFalse(p.validateInitialization());
    }

    @Test
    public void initializationOnOnePathIsAccepted() {
        Procedure p = SampleProcedures.initializedOnOnePath();
        DestructInstruction destructV = p.destructInstructions().get(0);
        InitState state = p.findInitializationStateBeforeInstruction(destructV, destructV.variable());
        Assert.assertTrue(state.canBeInitialized());
        Assert.assertTrue(state.canBeUninitialized());
        Assert.assertTrue(state.isAmbiguous());
        Assert.assertTrue(p.validate());
    }

    @Test
    public void ambiguousStateIsReportedButAccepted() {
        Procedure p = SampleProcedures.initializedOnOnePath();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        p.validator().setStatusStream(new PrintStream(out, true));

        Assert.assertTrue(p.validate());
        String log = out.toString();
        Assert.assertTrue(log, log.contains("procedure-validator: $1(v) may or may not be initialized"));
    }

    @Test
    public void loopStateTerminatesAndFollowsBackEdge() {
        Procedure p = SampleProcedures.loop();
        Variable value = p.variables().get(0);
        Variable c = p.variables().get(1);
        CallInstruction test = p.callInstructions().get(0);

        InitState state = p.findInitializationStateBeforeInstruction(test, c);
        Assert.assertFalse(state.canBeInitialized());
        Assert.assertTrue(state.canBeUninitialized());

        state = p.findInitializationStateBeforeInstruction(test, value);
        Assert.assertTrue(state.canBeInitialized());
        Assert.assertFalse(state.canBeUninitialized());
    }

    @Test
    public void failureReasonIsLogged() {
        Procedure p = new Procedure();
        Variable v = p.newVariable(DataType.FLOAT, "v");
        CallInstruction call = p.newCallInstruction(SampleFunctions.CONSTANT);
        call.setParamVariable(0, v);
        finishWithDestructs(p, call);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        p.validator().setStatusStream(new PrintStream(out, true));
        Assert.assertFalse(p.validate());
        Assert.assertTrue(out.toString().contains("$0(v) is not destructed before return #1."));
    }

    @Test
    public void nothingIsLoggedWithoutStatusStream() {
        Procedure p = new Procedure();
        Assert.assertNull(p.validator().getStatusStream());
        Assert.assertFalse(p.validate());
    }

    @Test
    public void assertValidNamesFailure() {
        Procedure p = new Procedure();
        p.newReturnInstruction();
        try {
            p.assertValid();
            Assert.fail("Expected validation to fail.");
        } catch (ProcedureValidationException e) {
            Assert.assertEquals("Procedure has no entry instruction.", e.getMessage());
        }
    }
}

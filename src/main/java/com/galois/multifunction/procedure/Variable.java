package com.galois.multifunction.procedure;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.multifunction.DataType;
import com.galois.multifunction.Typed;
import com.galois.multifunction.proto.Protos;

/**
 * A typed value slot in a procedure.
 *
 * Variables are not owned by the instructions that use them.  Every
 * instruction that references a variable is recorded in its users list;
 * the list is kept in sync by the instruction setters.
 */
public final class Variable implements Typed {
    private final Procedure procedure;
    private final int id;
    private final DataType type;
    private String name;
    private final ArrayList<Instruction> users;

    /** Package level method for creating a variable. */
    Variable(Procedure procedure, int id, DataType type, String name) {
        this.procedure = procedure;
        this.id = id;
        this.type = type;
        this.name = name;
        this.users = new ArrayList<Instruction>();
    }

    /**
     * Get procedure that this variable is part of.
     */
    public Procedure getProcedure() {
        return procedure;
    }

    /**
     * Get id of variable.  Ids are assigned in creation order.
     */
    public int id() {
        return id;
    }

    /**
     * Get type of variable.
     * @return The type.
     */
    public DataType type() {
        return type;
    }

    /**
     * Debug name of the variable, possibly empty.
     */
    public String name() {
        return name;
    }

    public void setName(String name) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
    }

    /**
     * Instructions that reference this variable.  An instruction that
     * references the variable more than once is listed once per reference.
     */
    public List<Instruction> users() {
        return Collections.unmodifiableList(users);
    }

    void addUser(Instruction instruction) {
        users.add(instruction);
    }

    void removeUser(Instruction instruction) {
        Instruction.removeFirstOccurrenceAndReorder(users, instruction);
    }

    /**
     * Get the Protocol buffer representation.
     * @return the representation object.
     */
    public Protos.Variable getVariableRep() {
        return Protos.Variable.newBuilder()
            .setId(id)
            .setName(name)
            .setType(type.getTypeRep())
            .build();
    }

    /**
     * Print as <code>$id</code> or <code>$id(name)</code>.
     */
    public String toString() {
        if (name.isEmpty()) {
            return "$" + id;
        }
        return "$" + id + "(" + name + ")";
    }
}

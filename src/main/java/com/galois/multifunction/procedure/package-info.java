/**
 * This package contains the procedure graph: variables, the instructions
 * that operate on them, and the checks and renderings built on top.
 *
 * <p>
 * To build a procedure see {@link com.galois.multifunction.procedure.Procedure}
 * or the more convenient
 * {@link com.galois.multifunction.procedure.ProcedureBuilder}.  A procedure
 * must pass {@link com.galois.multifunction.procedure.Procedure#validate()}
 * before it is handed to an execution engine.
 */
package com.galois.multifunction.procedure;

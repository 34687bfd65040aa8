/**
 * Minimal document model for directed graphs in the dot language, as
 * rendered by Graphviz.
 */
package com.galois.multifunction.dot;

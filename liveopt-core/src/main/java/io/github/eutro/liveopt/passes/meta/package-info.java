/**
 * {@link io.github.eutro.liveopt.passes.IRPass IR passes} that compute or check metadata,
 * attaching it as {@link io.github.eutro.liveopt.ext.Ext exts}, without changing the IR itself.
 */
package io.github.eutro.liveopt.passes.meta;

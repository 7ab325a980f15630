/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.support;

import java.util.Arrays;

/**
 * A class that takes logging messages and distributes them to LoggerHooks.
 * It implements LoggerHook itself, so that instances can be chained (just
 * don't create loops).
 */
public class LoggerHookChain extends LoggerHook {

    // We will only very rarely add or remove hooks
    private LoggerHook[] hooks;

    /**
     * Create a logger. Threshhold set to NORMAL.
     */
    public LoggerHookChain() {
        this(LogLevel.NORMAL);
    }

    /**
     * Create a logger.
     * @param threshold   Suppress all log calls with lower priority then
     *                     this.
     */
    public LoggerHookChain(LogLevel threshold) {
        super(threshold);
        hooks = new LoggerHook[0];
    }

    @Override
    public void log(Object o, Class<?> c, String msg, Throwable e, LogLevel priority) {
        LoggerHook[] current;
        synchronized(this) {
            current = hooks;
        }
        for(LoggerHook hook: current) {
            hook.log(o,c,msg,e,priority);
        }
    }

    /**
     * Add a hook which will be called every time a message is logged
     */
    public synchronized void addHook(LoggerHook lh) {
        LoggerHook[] newHooks = Arrays.copyOf(hooks, hooks.length+1);
        newHooks[hooks.length] = lh;
        hooks = newHooks;
    }

    /**
     * Remove a hook from the logger.
     */
    public synchronized void removeHook(LoggerHook lh) {
        final int hooksLength = hooks.length;
        if(hooksLength == 0) return;
        LoggerHook[] newHooks = new LoggerHook[hooksLength-1];
        int x=0;
        for(int i=0;i<hooksLength;i++) {
            if(hooks[i] == lh) continue;
            if(x == newHooks.length) return; // nothing matched
            newHooks[x++] = hooks[i];
        }
        if(x == newHooks.length) {
            hooks = newHooks;
        } else {
            hooks = Arrays.copyOf(newHooks, x);
        }
    }

    /**
     * Returns all the current hooks.
     */
    public synchronized LoggerHook[] getHooks() {
        return hooks.clone();
    }
}

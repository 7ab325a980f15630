/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.support;

/**
 * Called when the thresholds of the global logger change. Classes use this
 * to keep a cached static logMINOR/logDEBUG flag current.
 */
public abstract class LogThresholdCallback {

	public abstract void shouldUpdate();
}

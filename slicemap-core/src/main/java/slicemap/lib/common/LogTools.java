/*-
 * #%L
 * This file is part of SliceMap.
 * %%
 * Copyright (C) 2024 SliceMap developers
 * %%
 * SliceMap is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SliceMap is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SliceMap.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */


package slicemap.lib.common;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Helper class for logging.
 */
public class LogTools {
	
	private static final Set<String> logged = ConcurrentHashMap.newKeySet();

	/**
	 * Log a message the first time it is requested for a specific logger and level.
	 * Later requests with the same logger name, level and message are ignored.
	 * 
	 * @param logger
	 * @param level
	 * @param message
	 * @return true if the message was logged by this call
	 */
	public static boolean logOnce(Logger logger, Level level, String message) {
		if (!logged.add(logger.getName() + "|" + level + "|" + message))
			return false;
		logger.atLevel(level).log(message);
		return true;
	}

}

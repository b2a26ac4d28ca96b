// This file is part of metrics-agent.
// Copyright (C) 2016-2026  The metrics-agent Authors.
//
// This program is free software: you can redistribute it and/or modify it
// under the terms of the GNU Lesser General Public License as published by
// the Free Software Foundation, either version 2.1 of the License, or (at your
// option) any later version.  This program is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the implied warranty
// of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU Lesser
// General Public License for more details.  You should have received a copy
// of the GNU Lesser General Public License along with this program.  If not,
// see <http://www.gnu.org/licenses/>.
package net.metricsagent.util;

import java.net.InetSocketAddress;

/**
 * <p>Title: StringsUtil</p>
 * <p>Description: String splitting and address parsing helpers</p>
 * <p><code>net.metricsagent.util.StringsUtil</code></p>
 */

public class StringsUtil {

	  /**
	   * Optimized version of {@code String#split} that doesn't use regexps.
	   * This function works in O(5n) where n is the length of the string to
	   * split.
	   * @param s The string to split.
	   * @param c The separator to use to split the string.
	   * @return A non-null, non-empty array.
	   */
	  public static String[] splitString(final String s, final char c) {
	    final char[] chars = s.toCharArray();
	    int num_substrings = 1;
	    for (final char x : chars) {
	      if (x == c) {
	        num_substrings++;
	      }
	    }
	    final String[] result = new String[num_substrings];
	    final int len = chars.length;
	    int start = 0;  // starting index in chars of the current substring.
	    int pos = 0;    // current index in chars.
	    int i = 0;      // number of the current substring.
	    for (; pos < len; pos++) {
	      if (chars[pos] == c) {
	        result[i++] = new String(chars, start, pos - start);
	        start = pos + 1;
	      }
	    }
	    result[i] = new String(chars, start, pos - start);
	    return result;
	  }

	  /**
	   * Parses a <b><code>host:port</code></b> endpoint into an unresolved socket address.
	   * A missing port is replaced with the passed default.
	   * @param address The address to parse
	   * @param defaultPort The port to use when none is specified
	   * @return the socket address
	   */
	  public static InetSocketAddress toAddress(final String address, final int defaultPort) {
		  if(address==null || address.trim().isEmpty()) throw new IllegalArgumentException("The passed address was null or empty");
		  final String[] frags = splitString(address.trim(), ':');
		  if(frags.length > 2) throw new IllegalArgumentException("Invalid address [" + address + "]");
		  final String host = frags[0].trim();
		  if(host.isEmpty()) throw new IllegalArgumentException("Invalid address [" + address + "], no host");
		  final int port;
		  if(frags.length==1 || frags[1].trim().isEmpty()) {
			  port = defaultPort;
		  } else {
			  try {
				  port = Integer.parseInt(frags[1].trim());
			  } catch (NumberFormatException nfe) {
				  throw new IllegalArgumentException("Invalid port in address [" + address + "]", nfe);
			  }
		  }
		  return InetSocketAddress.createUnresolved(host, port);
	  }

	private StringsUtil() {}

}

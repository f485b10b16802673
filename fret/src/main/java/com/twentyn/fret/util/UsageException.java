/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.fret.util;

/**
 * Ends a command line run before any work is done, either because the arguments are unusable or because help was
 * requested.  Carries the process exit status to report.
 */
public class UsageException extends Exception {
  private final int exitStatus;

  public UsageException(String message) {
    this(message, 1);
  }

  public UsageException(String message, int exitStatus) {
    super(message);
    this.exitStatus = exitStatus;
  }

  public int getExitStatus() {
    return exitStatus;
  }

  public boolean isHelpRequest() {
    return exitStatus == 0;
  }
}

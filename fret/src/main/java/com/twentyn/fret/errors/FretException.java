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

package com.twentyn.fret.errors;

/**
 * Base class of every error that aborts a single FRET computation.  All of these are deterministic consequences of the
 * caller's data, so none of them are worth retrying.
 */
public class FretException extends Exception {
  private final AnalysisStage stage;

  public FretException(AnalysisStage stage, String msg) {
    super(String.format("[%s] %s", stage.getDescription(), msg));
    this.stage = stage;
  }

  public FretException(AnalysisStage stage, String msg, Throwable cause) {
    super(String.format("[%s] %s", stage.getDescription(), msg), cause);
    this.stage = stage;
  }

  public AnalysisStage getStage() {
    return stage;
  }
}

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

package com.twentyn.fret.analysis;

import com.twentyn.fret.errors.AnalysisStage;
import com.twentyn.fret.errors.DataQualityException;
import com.twentyn.fret.errors.FretException;
import com.twentyn.fret.errors.InputException;
import com.twentyn.fret.errors.NumericDomainException;

import java.util.Optional;

/**
 * Either a {@link ComputationResult} or the error that stopped the run, for callers that would rather branch on a
 * value than catch.  Exactly one of the two is present.
 */
public class AnalysisOutcome {
  public enum Kind {
    SUCCESS,
    INPUT_ERROR,
    DATA_QUALITY_ERROR,
    NUMERIC_DOMAIN_ERROR
  }

  private final ComputationResult result;
  private final FretException error;

  private AnalysisOutcome(ComputationResult result, FretException error) {
    this.result = result;
    this.error = error;
  }

  public static AnalysisOutcome success(ComputationResult result) {
    return new AnalysisOutcome(result, null);
  }

  public static AnalysisOutcome failure(FretException error) {
    return new AnalysisOutcome(null, error);
  }

  public boolean isSuccess() {
    return result != null;
  }

  public Kind getKind() {
    if (result != null) {
      return Kind.SUCCESS;
    }
    if (error instanceof InputException) {
      return Kind.INPUT_ERROR;
    }
    if (error instanceof DataQualityException) {
      return Kind.DATA_QUALITY_ERROR;
    }
    if (error instanceof NumericDomainException) {
      return Kind.NUMERIC_DOMAIN_ERROR;
    }
    throw new IllegalStateException("Unrecognized error type " + error.getClass().getName());
  }

  public Optional<ComputationResult> getResult() {
    return Optional.ofNullable(result);
  }

  public Optional<FretException> getError() {
    return Optional.ofNullable(error);
  }

  public Optional<AnalysisStage> getFailedStage() {
    return error == null ? Optional.empty() : Optional.of(error.getStage());
  }
}

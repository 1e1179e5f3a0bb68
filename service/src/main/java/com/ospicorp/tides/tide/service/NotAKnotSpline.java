package com.ospicorp.tides.tide.service;

import java.util.Arrays;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Cubic spline interpolant with not-a-knot end conditions: the third derivative is continuous at
 * the second and the second-to-last knot. Three knots give the interpolating parabola, two give a
 * straight line.
 *
 * <p>The second derivatives {@code M_i} solve a tridiagonal system once the end conditions have
 * been used to eliminate {@code M_0} and {@code M_(n-1)}.
 */
final class NotAKnotSpline implements UnivariateFunction {
  private final double[] x;
  private final double[] y;
  private final PolynomialSplineFunction pieces;

  private NotAKnotSpline(double[] x, double[] y, PolynomialFunction[] polynomials) {
    this.x = x;
    this.y = y;
    this.pieces = new PolynomialSplineFunction(x, polynomials);
  }

  static NotAKnotSpline interpolate(double[] x, double[] y) {
    if (x.length != y.length) {
      throw new IllegalArgumentException("x and y must have the same length");
    }
    int n = x.length;
    if (n < 2) {
      throw new InsufficientDataException("Spline interpolation needs at least 2 points, got " + n);
    }
    for (int i = 1; i < n; i++) {
      if (!(x[i] > x[i - 1])) {
        throw new IllegalArgumentException("Spline knots must be strictly increasing");
      }
    }
    double[] xs = x.clone();
    double[] ys = y.clone();
    double[] h = new double[n - 1];
    double[] slope = new double[n - 1];
    for (int i = 0; i < n - 1; i++) {
      h[i] = xs[i + 1] - xs[i];
      slope[i] = (ys[i + 1] - ys[i]) / h[i];
    }

    PolynomialFunction[] polys = new PolynomialFunction[n - 1];
    if (n == 2) {
      polys[0] = new PolynomialFunction(new double[] {ys[0], slope[0]});
    } else if (n == 3) {
      double c2 = (slope[1] - slope[0]) / (xs[2] - xs[0]);
      polys[0] = new PolynomialFunction(new double[] {ys[0], slope[0] - c2 * h[0], c2});
      polys[1] = new PolynomialFunction(new double[] {ys[1], slope[0] + c2 * h[0], c2});
    } else {
      double[] m = secondDerivatives(h, slope);
      for (int i = 0; i < n - 1; i++) {
        polys[i] = new PolynomialFunction(new double[] {
            ys[i],
            slope[i] - h[i] * (2d * m[i] + m[i + 1]) / 6d,
            m[i] / 2d,
            (m[i + 1] - m[i]) / (6d * h[i])
        });
      }
    }
    return new NotAKnotSpline(xs, ys, polys);
  }

  // n >= 4 knots
  private static double[] secondDerivatives(double[] h, double[] slope) {
    int n = h.length + 1;
    int size = n - 2;
    double[] sub = new double[size];
    double[] diag = new double[size];
    double[] sup = new double[size];
    double[] rhs = new double[size];
    for (int i = 1; i <= n - 2; i++) {
      int k = i - 1;
      sub[k] = h[i - 1];
      diag[k] = 2d * (h[i - 1] + h[i]);
      sup[k] = h[i];
      rhs[k] = 6d * (slope[i] - slope[i - 1]);
    }
    // eliminate M_0 and M_(n-1)
    double h0 = h[0];
    double h1 = h[1];
    diag[0] = 3d * h0 + 2d * h1 + h0 * h0 / h1;
    sup[0] = h1 - h0 * h0 / h1;
    sub[0] = 0d;
    double hl = h[n - 2];
    double hp = h[n - 3];
    diag[size - 1] = 2d * hp + 3d * hl + hl * hl / hp;
    sub[size - 1] = hp - hl * hl / hp;
    sup[size - 1] = 0d;

    double[] inner = solveTridiagonal(sub, diag, sup, rhs);
    double[] m = new double[n];
    System.arraycopy(inner, 0, m, 1, size);
    m[0] = m[1] - h0 / h1 * (m[2] - m[1]);
    m[n - 1] = m[n - 2] + hl / hp * (m[n - 2] - m[n - 3]);
    return m;
  }

  // Thomas algorithm; the system is strictly diagonally dominant so no pivoting is needed
  private static double[] solveTridiagonal(double[] sub, double[] diag, double[] sup, double[] rhs) {
    int size = diag.length;
    double[] c = new double[size];
    double[] d = new double[size];
    c[0] = sup[0] / diag[0];
    d[0] = rhs[0] / diag[0];
    for (int i = 1; i < size; i++) {
      double denom = diag[i] - sub[i] * c[i - 1];
      c[i] = sup[i] / denom;
      d[i] = (rhs[i] - sub[i] * d[i - 1]) / denom;
    }
    double[] out = new double[size];
    out[size - 1] = d[size - 1];
    for (int i = size - 2; i >= 0; i--) {
      out[i] = d[i] - c[i] * out[i + 1];
    }
    return out;
  }

  double lower() {
    return x[0];
  }

  double upper() {
    return x[x.length - 1];
  }

  boolean isInRange(double v) {
    return v >= lower() && v <= upper();
  }

  @Override
  public double value(double v) {
    int idx = Arrays.binarySearch(x, v);
    if (idx >= 0) {
      return y[idx];
    }
    return pieces.value(v);
  }
}

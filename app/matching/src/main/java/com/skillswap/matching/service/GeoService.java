/*
 * どこで: Matching サービス
 * 何を: 大圏距離/半径判定/円環内ランダム点生成/座標検証を提供する
 * なぜ: 候補探索と合成ユーザー配置の距離計算を 1 箇所に閉じ込めるため
 */
package com.skillswap.matching.service;

import com.skillswap.matching.api.InvalidSkillSwapRequestException;
import com.skillswap.matching.model.GeoPoint;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Service;

@Service
public class GeoService {

  static final double EARTH_RADIUS_MILES = 3958.8;

  // 浮動小数点誤差で円環の外へ出た場合の再抽選回数
  static final int MAX_SAMPLE_ATTEMPTS = 16;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RandomGenerator は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RandomGenerator random;

  public GeoService(RandomGenerator random) {
    this.random = random;
  }

  /** Haversine 式による大圏距離 (マイル)。 */
  public double distance(double lat1, double lon1, double lat2, double lon2) {
    final double phi1 = Math.toRadians(lat1);
    final double phi2 = Math.toRadians(lat2);
    final double deltaPhi = Math.toRadians(lat2 - lat1);
    final double deltaLambda = Math.toRadians(lon2 - lon1);
    final double sinPhi = Math.sin(deltaPhi / 2);
    final double sinLambda = Math.sin(deltaLambda / 2);
    final double a = sinPhi * sinPhi + Math.cos(phi1) * Math.cos(phi2) * sinLambda * sinLambda;
    // 丸め誤差で a が [0, 1] をわずかに外れても NaN にしない
    final double clamped = Math.min(1.0, Math.max(0.0, a));
    return 2 * EARTH_RADIUS_MILES * Math.asin(Math.sqrt(clamped));
  }

  public double distance(GeoPoint from, GeoPoint to) {
    return distance(from.latitude(), from.longitude(), to.latitude(), to.longitude());
  }

  public boolean withinRadius(
      double lat1, double lon1, double lat2, double lon2, double radiusMiles) {
    return distance(lat1, lon1, lat2, lon2) <= radiusMiles;
  }

  /**
   * 役割: center から [minMiles, maxMiles] の円環内にランダムな点を生成する。
   * 動作: 方位角 [0, 2π) と距離を一様に引き、destination-point 式で投影する。
   * 生成点を distance() で再計算し、範囲外なら再抽選する。
   * 規約: 経度は [-180, 180) に正規化し、緯度は [-90, 90] にクランプする。
   */
  public GeoPoint randomPointNear(
      double centerLat, double centerLon, double minMiles, double maxMiles) {
    validateCoordinates(centerLat, centerLon);
    if (!(minMiles >= 0) || !(maxMiles >= minMiles)) {
      throw new IllegalArgumentException(
          "distance range must satisfy 0 <= min <= max: " + minMiles + ", " + maxMiles);
    }
    for (int attempt = 0; attempt < MAX_SAMPLE_ATTEMPTS; attempt++) {
      final double bearing = random.nextDouble() * 2 * Math.PI;
      final double miles = maxMiles > minMiles ? random.nextDouble(minMiles, maxMiles) : minMiles;
      final GeoPoint candidate = project(centerLat, centerLon, bearing, miles);
      final double actual =
          distance(centerLat, centerLon, candidate.latitude(), candidate.longitude());
      if (actual >= minMiles && actual <= maxMiles) {
        return candidate;
      }
    }
    // 再抽選で収まらない場合は円環の中央距離で北向きに投影する
    return project(centerLat, centerLon, 0.0, (minMiles + maxMiles) / 2);
  }

  public GeoPoint randomPointNear(GeoPoint center, double minMiles, double maxMiles) {
    return randomPointNear(center.latitude(), center.longitude(), minMiles, maxMiles);
  }

  /** 不正な座標はミューテーション前に検出し、フィールド名付きの 400 として返す。 */
  public void validateCoordinates(Double latitude, Double longitude) {
    if (latitude == null || !Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
      throw new InvalidSkillSwapRequestException(
          "latitude", "must be a finite number between -90 and 90");
    }
    if (longitude == null || !Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
      throw new InvalidSkillSwapRequestException(
          "longitude", "must be a finite number between -180 and 180");
    }
  }

  private GeoPoint project(double centerLat, double centerLon, double bearing, double miles) {
    final double angular = miles / EARTH_RADIUS_MILES;
    final double phi1 = Math.toRadians(centerLat);
    final double lambda1 = Math.toRadians(centerLon);
    final double sinPhi2 =
        Math.sin(phi1) * Math.cos(angular)
            + Math.cos(phi1) * Math.sin(angular) * Math.cos(bearing);
    final double phi2 = Math.asin(Math.min(1.0, Math.max(-1.0, sinPhi2)));
    final double lambda2 =
        lambda1
            + Math.atan2(
                Math.sin(bearing) * Math.sin(angular) * Math.cos(phi1),
                Math.cos(angular) - Math.sin(phi1) * Math.sin(phi2));
    return new GeoPoint(
        clampLatitude(Math.toDegrees(phi2)), normalizeLongitude(Math.toDegrees(lambda2)));
  }

  static double normalizeLongitude(double longitude) {
    final double normalized = ((longitude + 540.0) % 360.0) - 180.0;
    return normalized == 180.0 ? -180.0 : normalized;
  }

  static double clampLatitude(double latitude) {
    return Math.max(-90.0, Math.min(90.0, latitude));
  }
}

package likelion._th.roadwatch.repository;

import likelion._th.roadwatch.domain.BadSegment;

import java.util.List;

public interface BadSegmentRepository {

    /**
     * 기존 구간을 모두 지우고 새 구간을 저장한다.
     * 트랜잭션이 아니므로 교체 도중 읽으면 비어 있거나 일부만 보일 수 있다.
     *
     * @return 저장한 구간 수
     */
    int replaceAll(List<BadSegment> segments);

    List<BadSegment> findAll();
}

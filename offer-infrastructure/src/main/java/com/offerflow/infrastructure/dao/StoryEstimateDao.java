package com.offerflow.infrastructure.dao;

import com.offerflow.infrastructure.dao.po.StoryEstimatePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

/**
 * 故事估算 DAO
 */
@Mapper
public interface StoryEstimateDao {

    int insert(StoryEstimatePO po);

    int update(StoryEstimatePO po);

    StoryEstimatePO selectByStoryId(@Param("storyId") Long storyId);

    /**
     * 批量按故事 ID 查询
     */
    List<StoryEstimatePO> selectByStoryIds(@Param("storyIds") Collection<Long> storyIds);
}
